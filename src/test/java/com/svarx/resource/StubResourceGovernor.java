package com.svarx.resource;

import java.util.ArrayList;
import java.util.List;

public final class StubResourceGovernor implements ResourceGovernor {
    private final List<String> calls = new ArrayList<>();
    private volatile ResourceSample sample;
    private volatile PowerMode powerMode = PowerMode.NORMAL;

    public StubResourceGovernor(ResourceSample sample) {
        this.sample = sample;
    }

    public static StubResourceGovernor quiet() {
        return new StubResourceGovernor(new ResourceSample(100L * 1024 * 1024, 0.5));
    }

    public void setSample(ResourceSample sample) {
        this.sample = sample;
    }

    public synchronized List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public synchronized void enterLowPower() {
        calls.add("low");
        powerMode = PowerMode.LOW;
    }

    @Override
    public synchronized void enterNormalPower() {
        calls.add("normal");
        powerMode = PowerMode.NORMAL;
    }

    @Override
    public PowerMode powerMode() {
        return powerMode;
    }

    @Override
    public ResourceSample sample() {
        return sample;
    }

    @Override
    public synchronized void reclaimMemory() {
        calls.add("reclaim");
    }
}
