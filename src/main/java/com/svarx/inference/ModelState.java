package com.svarx.inference;

public enum ModelState {
    UNLOADED,
    LOADING,
    LOADED,
    EVICTING
}
