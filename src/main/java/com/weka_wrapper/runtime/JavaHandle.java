package com.weka_wrapper.runtime;

/**
 * Opaque reference to a WEKA object owned by one {@link WekaRuntime}. Access fails once the
 * runtime has been stopped. Identity only: two handles are never equal by content.
 */
public final class JavaHandle<T> {

    private final WekaRuntime runtime;
    private final T object;

    JavaHandle(WekaRuntime runtime, T object) {
        this.runtime = runtime;
        this.object = object;
    }

    public T get() {
        runtime.ensureRunning();
        return object;
    }

    public WekaRuntime getRuntime() {
        return runtime;
    }

    public boolean isValid() {
        return runtime.isRunning();
    }

    @Override
    public String toString() {
        return "JavaHandle[" + object.getClass().getName() + (isValid() ? "" : ", stopped") + "]";
    }
}
