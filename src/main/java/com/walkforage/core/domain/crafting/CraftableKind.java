package com.walkforage.core.domain.crafting;

public enum CraftableKind {
    TOOL,
    COMPONENT
}
