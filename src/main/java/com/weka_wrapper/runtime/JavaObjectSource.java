package com.weka_wrapper.runtime;

import weka.core.Utils;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Where a wrapped WEKA object comes from: a class name with options, or an object that
 * already exists.
 */
public interface JavaObjectSource {

    Object resolve(WekaRuntime runtime) throws Exception;

    static JavaObjectSource fromClassName(String classname, String... options) {
        return new FromClassName(classname, Arrays.asList(options));
    }

    /**
     * Parses a WEKA command line such as {@code "weka.classifiers.trees.J48 -C 0.25"}.
     */
    static JavaObjectSource fromCommandLine(String commandLine) throws Exception {
        String[] parts = Utils.splitOptions(commandLine);
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("No classname in command line: '" + commandLine + "'");
        }
        String classname = parts[0];
        return new FromClassName(classname, Arrays.asList(Arrays.copyOfRange(parts, 1, parts.length)));
    }

    static JavaObjectSource fromExisting(Object object) {
        return new FromExisting(object);
    }

    record FromClassName(String classname, List<String> options) implements JavaObjectSource {

        public FromClassName {
            Objects.requireNonNull(classname, "classname");
            options = List.copyOf(options);
        }

        @Override
        public Object resolve(WekaRuntime runtime) throws Exception {
            return runtime.newInstance(classname, options.toArray(new String[0]));
        }
    }

    record FromExisting(Object object) implements JavaObjectSource {

        public FromExisting {
            Objects.requireNonNull(object, "object");
        }

        @Override
        public Object resolve(WekaRuntime runtime) {
            runtime.ensureRunning();
            return object;
        }
    }
}
