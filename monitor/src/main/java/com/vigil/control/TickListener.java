package com.vigil.control;

@FunctionalInterface
public interface TickListener {

    void onTick();
}
