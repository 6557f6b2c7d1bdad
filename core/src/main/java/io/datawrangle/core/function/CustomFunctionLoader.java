package io.datawrangle.core.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.error.CustomFunctionError;
import io.datawrangle.core.model.Dataset;
import io.datawrangle.core.spi.ColumnFunction;
import io.datawrangle.core.spi.DatasetFunction;
import io.datawrangle.core.spi.RowFunction;
import java.io.Closeable;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads user-supplied functions for one run.
 *
 * <p>Symbols are looked up in a class loader over the run's libraries (plus any {@code file} named
 * by a reference), delegating to the application class loader. Resolved functions are cached by
 * reference; the class loaders are released by {@link #close()} when the run ends, so one run's
 * code is never visible to another.
 *
 * <p>Thread-safe for concurrent lookups within a run.
 */
public final class CustomFunctionLoader implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CustomFunctionLoader.class);

    private final URLClassLoader libraryLoader;
    private final Path baseDirectory;
    private final Map<Path, URLClassLoader> fileLoaders = new LinkedHashMap<>();
    private final Map<CustomFunctionReference, Object> cache = new LinkedHashMap<>();
    private boolean closed;

    private CustomFunctionLoader(URLClassLoader libraryLoader, Path baseDirectory) {
        this.libraryLoader = libraryLoader;
        this.baseDirectory = baseDirectory;
    }

    /**
     * Creates a loader over the given libraries.
     *
     * @param libraries     JARs or class directories searched for every reference
     * @param baseDirectory directory that relative {@code file} values are resolved against
     * @throws CustomFunctionError if a library does not exist
     */
    public static CustomFunctionLoader create(List<Path> libraries, Path baseDirectory) {
        List<URL> urls = new ArrayList<>();
        for (Path library : libraries) {
            urls.add(toUrl(library, library.toString()));
        }
        URLClassLoader loader =
                new URLClassLoader(urls.toArray(new URL[0]), CustomFunctionLoader.class.getClassLoader());
        LOG.debug("Custom function loader created: libraries={}", libraries);
        return new CustomFunctionLoader(loader, baseDirectory);
    }

    /** Creates a loader that only sees the application class path. */
    public static CustomFunctionLoader create() {
        return create(List.of(), Path.of("."));
    }

    /** Resolves a row function. */
    public RowFunction rowFunction(CustomFunctionReference reference) {
        return (RowFunction) resolve(reference, FunctionType.ROW);
    }

    /** Resolves a column function. */
    public ColumnFunction columnFunction(CustomFunctionReference reference) {
        return (ColumnFunction) resolve(reference, FunctionType.COLUMN);
    }

    /** Resolves a dataset function. */
    public DatasetFunction datasetFunction(CustomFunctionReference reference) {
        return (DatasetFunction) resolve(reference, FunctionType.DATASET);
    }

    /**
     * Resolves a reference to an instance of the interface matching its type, checking the
     * symbol's signature.
     *
     * @throws CustomFunctionError if the symbol cannot be loaded or does not fit the type
     */
    public synchronized Object resolve(CustomFunctionReference reference) {
        return resolve(reference, reference.type());
    }

    private synchronized Object resolve(CustomFunctionReference reference, FunctionType expected) {
        if (closed) {
            throw new IllegalStateException("Custom function loader is closed");
        }
        if (reference.type() != expected) {
            throw new CustomFunctionError(
                    "Custom function declared as '" + reference.type().key() + "' used as '" + expected.key() + "'",
                    reference.toString());
        }
        Object cached = cache.get(reference);
        if (cached != null) {
            return cached;
        }
        Class<?> type = loadClass(reference);
        Object function = reference.methodName() == null
                ? instantiate(type, reference)
                : bindStaticMethod(type, reference);
        cache.put(reference, function);
        LOG.info("Custom function loaded: function={}, type={}", reference.function(), reference.type().key());
        return function;
    }

    private Class<?> loadClass(CustomFunctionReference reference) {
        ClassLoader loader = reference.file() == null ? libraryLoader : fileLoader(reference);
        try {
            return Class.forName(reference.className(), true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new CustomFunctionError(
                    "Class '" + reference.className() + "' not found", e, reference.toString());
        }
    }

    private URLClassLoader fileLoader(CustomFunctionReference reference) {
        Path path = baseDirectory.resolve(reference.file()).normalize();
        return fileLoaders.computeIfAbsent(
                path, p -> new URLClassLoader(new URL[] {toUrl(p, reference.toString())}, libraryLoader));
    }

    private static Object instantiate(Class<?> type, CustomFunctionReference reference) {
        Class<?> required = interfaceFor(reference.type());
        if (!required.isAssignableFrom(type)) {
            throw new CustomFunctionError(
                    "Class '" + type.getName() + "' does not implement " + required.getSimpleName(),
                    reference.toString());
        }
        try {
            return type.getConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new CustomFunctionError(
                    "Class '" + type.getName() + "' has no public no-arg constructor", e, reference.toString());
        } catch (InvocationTargetException e) {
            throw new CustomFunctionError(
                    "Constructor of '" + type.getName() + "' failed: " + e.getCause().getMessage(),
                    e.getCause(),
                    reference.toString());
        } catch (ReflectiveOperationException e) {
            throw new CustomFunctionError(
                    "Cannot instantiate '" + type.getName() + "': " + e.getMessage(), e, reference.toString());
        }
    }

    private static Object bindStaticMethod(Class<?> type, CustomFunctionReference reference) {
        Class<?> parameter;
        Class<?> result;
        switch (reference.type()) {
            case ROW -> {
                parameter = ObjectNode.class;
                result = JsonNode.class;
            }
            case COLUMN -> {
                parameter = List.class;
                result = List.class;
            }
            default -> {
                parameter = Dataset.class;
                result = Dataset.class;
            }
        }
        Method method;
        try {
            method = type.getMethod(reference.methodName(), parameter);
        } catch (NoSuchMethodException e) {
            throw new CustomFunctionError(
                    "Method '" + reference.methodName() + "(" + parameter.getSimpleName() + ")' not found on '"
                            + type.getName() + "'",
                    e,
                    reference.toString());
        }
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new CustomFunctionError(
                    "Method '" + reference.methodName() + "' must be static", reference.toString());
        }
        if (!result.isAssignableFrom(method.getReturnType())) {
            throw new CustomFunctionError(
                    "Method '" + reference.methodName() + "' must return " + result.getSimpleName() + " but returns "
                            + method.getReturnType().getSimpleName(),
                    reference.toString());
        }
        return switch (reference.type()) {
            case ROW -> (RowFunction) row -> (JsonNode) invoke(method, row);
            case COLUMN -> (ColumnFunction) values -> castList(invoke(method, values));
            case DATASET -> (DatasetFunction) dataset -> (Dataset) invoke(method, dataset);
        };
    }

    @SuppressWarnings("unchecked")
    private static List<JsonNode> castList(Object value) {
        return (List<JsonNode>) value;
    }

    private static Object invoke(Method method, Object argument) {
        try {
            return method.invoke(null, argument);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(method.getName() + " failed: " + cause.getMessage(), cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot call " + method.getName(), e);
        }
    }

    private static Class<?> interfaceFor(FunctionType type) {
        return switch (type) {
            case ROW -> RowFunction.class;
            case COLUMN -> ColumnFunction.class;
            case DATASET -> DatasetFunction.class;
        };
    }

    private static URL toUrl(Path path, String reference) {
        if (!Files.exists(path)) {
            throw new CustomFunctionError("Custom code file not found: " + path, reference);
        }
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new CustomFunctionError("Invalid custom code path: " + path, e, reference);
        }
    }

    /** Releases the class loaders. Functions resolved earlier must not be called afterwards. */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        cache.clear();
        for (URLClassLoader loader : fileLoaders.values()) {
            closeQuietly(loader);
        }
        closeQuietly(libraryLoader);
        LOG.debug("Custom function loader closed");
    }

    private static void closeQuietly(URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            LOG.warn("Failed to close custom code class loader", e);
        }
    }
}
