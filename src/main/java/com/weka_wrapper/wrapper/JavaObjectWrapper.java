package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaHandle;
import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;

/**
 * Base class for wrappers that own exactly one WEKA object.
 *
 * @param <T> the WEKA base type the wrapped object must be an instance of
 */
public abstract class JavaObjectWrapper<T> {

    private final JavaHandle<T> handle;
    private final String classname;

    protected JavaObjectWrapper(WekaRuntime runtime, JavaObjectSource source, Class<T> type) throws Exception {
        T object = WekaRuntime.enforceType(source.resolve(runtime), type);
        this.handle = runtime.adopt(object);
        this.classname = object.getClass().getName();
    }

    /**
     * The wrapped object. Fails with {@link IllegalStateException} once the runtime is stopped.
     */
    public T getJavaObject() {
        return handle.get();
    }

    public JavaHandle<T> getHandle() {
        return handle;
    }

    public WekaRuntime getRuntime() {
        return handle.getRuntime();
    }

    public String getClassname() {
        return classname;
    }

    @Override
    public String toString() {
        return getJavaObject().toString();
    }
}
