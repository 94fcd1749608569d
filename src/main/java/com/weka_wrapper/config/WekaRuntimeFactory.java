package com.weka_wrapper.config;

import com.weka_wrapper.runtime.WekaRuntime;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts {@link WekaRuntime} sessions whose classpath combines {@code weka.classpath} with the
 * segments given per command.
 */
@Component
public class WekaRuntimeFactory {

    private final List<String> baseClasspath;

    public WekaRuntimeFactory(@Value("${weka.classpath:}") String classpath) {
        this.baseClasspath = WekaRuntime.splitClasspath(classpath);
    }

    public WekaRuntime start(List<String> extraClasspath) {
        List<String> classpath = new ArrayList<>(baseClasspath);
        classpath.addAll(extraClasspath);
        return WekaRuntime.start(classpath);
    }

    public List<String> getBaseClasspath() {
        return baseClasspath;
    }
}
