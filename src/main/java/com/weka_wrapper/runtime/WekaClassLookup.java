package com.weka_wrapper.runtime;

import lombok.extern.slf4j.Slf4j;
import weka.core.WekaPackageClassLoaderManager;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Field;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * Makes the classes of a runtime's extra classpath visible to WEKA's own class lookups.
 * <p>
 * WEKA resolves class names found in options (e.g. {@code -W}) and in serialized experiments
 * through {@link WekaPackageClassLoaderManager}. When a name is neither on WEKA's classpath nor
 * in an installed WEKA package, the manager falls back to its class-name-to-loader table. Every
 * class found in the segments is entered there with the runtime's loader, and removed again when
 * the runtime stops. Names that already have an entry are left alone.
 */
@Slf4j
final class WekaClassLookup {

    private static final String LOOKUP_FIELD = "m_classBasedClassLoaderLookup";
    private static final String CLASS_SUFFIX = ".class";

    private final ClassLoader loader;
    private final List<String> registered;

    private WekaClassLookup(ClassLoader loader, List<String> registered) {
        this.loader = loader;
        this.registered = registered;
    }

    static WekaClassLookup register(ClassLoader loader, List<String> segments) {
        List<String> classNames = new ArrayList<>();
        for (String segment : segments) {
            classNames.addAll(listClasses(new File(segment)));
        }
        List<String> registered = new ArrayList<>();
        if (classNames.isEmpty()) {
            return new WekaClassLookup(loader, registered);
        }

        Map<String, ClassLoader> lookup = lookupTable();
        synchronized (lookup) {
            for (String name : classNames) {
                if (lookup.putIfAbsent(name, loader) == null) {
                    registered.add(name);
                }
            }
        }
        log.debug("Registered {} class(es) with WEKA's class lookup", registered.size());
        return new WekaClassLookup(loader, registered);
    }

    List<String> getRegistered() {
        return registered;
    }

    void unregister() {
        if (registered.isEmpty()) {
            return;
        }
        Map<String, ClassLoader> lookup = lookupTable();
        synchronized (lookup) {
            for (String name : registered) {
                lookup.remove(name, loader);
            }
        }
        log.debug("Removed {} class(es) from WEKA's class lookup", registered.size());
    }

    /**
     * Binary names of the classes in a directory or jar, e.g. {@code ext.Outer$Inner}.
     */
    static List<String> listClasses(File segment) {
        if (segment.isDirectory()) {
            return listDirectory(segment.toPath());
        }
        if (segment.isFile() && segment.getName().toLowerCase().endsWith(".jar")) {
            return listJar(segment);
        }
        log.warn("Skipping classpath entry that is neither a directory nor a jar: {}", segment);
        return List.of();
    }

    private static List<String> listDirectory(Path root) {
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(file -> root.relativize(file).toString().replace(File.separatorChar, '/'))
                    .filter(WekaClassLookup::isClassEntry)
                    .map(WekaClassLookup::toClassName)
                    .toList();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read classpath directory: " + root, e);
        }
    }

    private static List<String> listJar(File jar) {
        List<String> names = new ArrayList<>();
        try (JarFile jarFile = new JarFile(jar)) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (!entry.isDirectory() && isClassEntry(entry.getName())) {
                    names.add(toClassName(entry.getName()));
                }
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read classpath jar: " + jar, e);
        }
        return names;
    }

    private static boolean isClassEntry(String path) {
        return path.endsWith(CLASS_SUFFIX)
                && !path.startsWith("META-INF/")
                && !path.endsWith("module-info.class")
                && !path.endsWith("package-info.class");
    }

    private static String toClassName(String path) {
        return path.substring(0, path.length() - CLASS_SUFFIX.length()).replace('/', '.');
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ClassLoader> lookupTable() {
        try {
            Field field = WekaPackageClassLoaderManager.class.getDeclaredField(LOOKUP_FIELD);
            field.setAccessible(true);
            return (Map<String, ClassLoader>) field.get(WekaPackageClassLoaderManager.getWekaPackageClassLoaderManager());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new IllegalStateException("Cannot access WEKA's class lookup table", e);
        }
    }
}
