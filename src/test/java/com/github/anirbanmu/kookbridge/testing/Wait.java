package com.github.anirbanmu.kookbridge.testing;

import java.util.function.BooleanSupplier;

public final class Wait {
    private Wait() {
    }

    public static void until(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("timed out waiting for " + what);
            }
            Thread.sleep(5);
        }
    }
}
