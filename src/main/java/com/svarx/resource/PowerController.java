package com.svarx.resource;

interface PowerController {
    boolean applyLowPower(long pid);

    boolean applyNormalPower(long pid);
}
