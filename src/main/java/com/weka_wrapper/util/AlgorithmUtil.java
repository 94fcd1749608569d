package com.weka_wrapper.util;

import com.weka_wrapper.runtime.JavaObjectSource;
import lombok.extern.slf4j.Slf4j;
import weka.core.Utils;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class AlgorithmUtil {

    /**
     * Turns classifier command lines like {@code "weka.classifiers.trees.J48 -C 0.25"} into object sources.
     */
    public static List<JavaObjectSource> fromCommandLines(List<String> commandLines) throws Exception {
        List<JavaObjectSource> sources = new ArrayList<>();
        for (String commandLine : commandLines) {
            log.debug("Parsing command line: {}", commandLine);
            sources.add(JavaObjectSource.fromCommandLine(commandLine));
        }
        return sources;
    }

    public static String joinOptions(List<String> options) {
        return Utils.joinOptions(options.toArray(new String[0]));
    }
}
