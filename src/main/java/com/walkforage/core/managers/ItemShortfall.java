package com.walkforage.core.managers;

public record ItemShortfall(String itemId, int have, int needed) {}
