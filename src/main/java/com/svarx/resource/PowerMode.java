package com.svarx.resource;

public enum PowerMode {
    NORMAL,
    LOW
}
