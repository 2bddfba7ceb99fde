package com.wingz.api.shared.constants;

public enum AccessMode {
    READ,   // Safe methods
    WRITE   // Anything that mutates state
}
