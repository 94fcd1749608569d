package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import weka.core.OptionHandler;
import weka.core.Utils;

/**
 * Wrapper for WEKA objects that may be configured through command-line style options.
 */
public abstract class OptionHandlerWrapper<T> extends JavaObjectWrapper<T> {

    protected OptionHandlerWrapper(WekaRuntime runtime, JavaObjectSource source, Class<T> type) throws Exception {
        super(runtime, source, type);
    }

    public boolean isOptionHandler() {
        return getJavaObject() instanceof OptionHandler;
    }

    /**
     * The current options, or an empty array if the object does not handle options.
     */
    public String[] getOptions() {
        Object object = getJavaObject();
        if (object instanceof OptionHandler) {
            return ((OptionHandler) object).getOptions();
        }
        return new String[0];
    }

    public void setOptions(String... options) throws Exception {
        Object object = getJavaObject();
        if (!(object instanceof OptionHandler)) {
            throw new UnsupportedOperationException(getClassname() + " does not handle options");
        }
        ((OptionHandler) object).setOptions(options.clone());
    }

    /**
     * Class name plus options, e.g. {@code weka.clusterers.SimpleKMeans -N 3 ...}.
     */
    public String toCommandLine() {
        return Utils.toCommandLine(getJavaObject());
    }
}
