package com.weka_wrapper.runtime;

import com.weka_wrapper.exception.TypeMismatchException;
import lombok.extern.slf4j.Slf4j;
import weka.core.OptionHandler;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Constructor;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A session in which WEKA objects are created and used.
 * <p>
 * The session owns a class loader that sees the supplied classpath segments (extra jars or
 * directories, e.g. WEKA packages) on top of the application classpath. The classes in those
 * segments are also registered with WEKA's own class lookup, so class names inside options and
 * serialized experiments resolve as well. Every object created or adopted through the session
 * is handed out as a {@link JavaHandle}; once the session is stopped those handles refuse access.
 */
@Slf4j
public class WekaRuntime implements AutoCloseable {

    private final List<String> classpath;
    private final URLClassLoader classLoader;
    private final WekaClassLookup classLookup;
    private volatile boolean running;

    private WekaRuntime(List<String> classpath, URLClassLoader classLoader, WekaClassLookup classLookup) {
        this.classpath = classpath;
        this.classLoader = classLoader;
        this.classLookup = classLookup;
        this.running = true;
    }

    public static WekaRuntime start() {
        return start(Collections.emptyList());
    }

    public static WekaRuntime start(List<String> classpath) {
        List<String> segments = new ArrayList<>();
        List<URL> urls = new ArrayList<>();
        for (String segment : classpath) {
            if (segment == null || segment.isBlank()) {
                continue;
            }
            segments.add(segment.trim());
            urls.add(toUrl(segment.trim()));
        }
        URLClassLoader loader = new URLClassLoader(urls.toArray(new URL[0]), WekaRuntime.class.getClassLoader());
        log.info("Starting WEKA runtime with classpath: {}", segments);
        WekaClassLookup classLookup = WekaClassLookup.register(loader, segments);
        return new WekaRuntime(Collections.unmodifiableList(segments), loader, classLookup);
    }

    /**
     * Splits a classpath string on the platform path separator.
     */
    public static List<String> splitClasspath(String classpath) {
        if (classpath == null || classpath.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.asList(classpath.split(File.pathSeparator));
    }

    private static URL toUrl(String segment) {
        try {
            return new File(segment).toURI().toURL();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid classpath entry: " + segment, e);
        }
    }

    public List<String> getClasspath() {
        return classpath;
    }

    /**
     * Class names from the extra classpath that WEKA's own lookups resolve through this session.
     */
    public List<String> getRegisteredClasses() {
        return Collections.unmodifiableList(classLookup.getRegistered());
    }

    public boolean isRunning() {
        return running;
    }

    public void ensureRunning() {
        if (!running) {
            throw new IllegalStateException("WEKA runtime has been stopped");
        }
    }

    public Class<?> loadClass(String classname) throws ClassNotFoundException {
        ensureRunning();
        return Class.forName(classname, true, classLoader);
    }

    /**
     * Instantiates the class via its public no-arg constructor and applies the options, if any.
     */
    public Object newInstance(String classname, String[] options) throws Exception {
        Class<?> clazz = loadClass(classname);
        Constructor<?> constructor = clazz.getConstructor();
        Object instance = constructor.newInstance();
        if (options != null && options.length > 0) {
            if (instance instanceof OptionHandler) {
                // setOptions consumes the array it is given
                ((OptionHandler) instance).setOptions(options.clone());
            } else {
                log.warn("Ignoring options {} for {}, it is not an OptionHandler", Arrays.toString(options), classname);
            }
        }
        return instance;
    }

    public <T> JavaHandle<T> adopt(T object) {
        ensureRunning();
        return new JavaHandle<>(this, object);
    }

    public static <T> T enforceType(Object object, Class<T> type) {
        if (object == null) {
            throw new TypeMismatchException(type.getName(), "null");
        }
        if (!type.isInstance(object)) {
            throw new TypeMismatchException(type.getName(), object.getClass().getName());
        }
        return type.cast(object);
    }

    public void stop() {
        if (!running) {
            log.debug("WEKA runtime already stopped");
            return;
        }
        running = false;
        classLookup.unregister();
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close runtime class loader: {}", e.getMessage());
        }
        log.info("WEKA runtime stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
