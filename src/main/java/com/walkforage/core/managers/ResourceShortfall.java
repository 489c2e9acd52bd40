package com.walkforage.core.managers;

public record ResourceShortfall(String resourceType, int have, int needed) {}
