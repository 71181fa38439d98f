package io.github.reugn.route4j.util;

import com.google.testing.compile.Compilation;
import io.github.reugn.route4j.processor.AutoRegisterProcessor;

import javax.tools.JavaFileObject;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static com.google.testing.compile.Compiler.javac;

/**
 * Helper for compiling and executing generated code at runtime.
 * Enables true E2E testing by actually running the generated routines.
 *
 * <p>Usage:
 * <pre>{@code
 * RuntimeTestHelper helper = RuntimeTestHelper.compile(handlers, routes);
 * List<Scope> scopes = new ArrayList<>();
 * helper.invoke("example.AppRoutesRegistration", "registerService", (ServiceConfig) scopes::add);
 * }</pre>
 */
public final class RuntimeTestHelper {

    private final Compilation compilation;
    private final ClassLoader classLoader;
    private final Map<String, Class<?>> loadedClasses;

    private RuntimeTestHelper(Compilation compilation) {
        this.compilation = compilation;
        this.classLoader = new CompiledClassLoader();
        this.loadedClasses = new HashMap<>();
    }

    /**
     * Compiles the given sources with the AutoRegisterProcessor.
     *
     * @param sources the source files to compile
     * @return a helper for executing the compiled code
     * @throws AssertionError if compilation fails
     */
    public static RuntimeTestHelper compile(JavaFileObject... sources) {
        Compilation compilation = javac()
                .withProcessors(new AutoRegisterProcessor())
                .compile(sources);

        if (compilation.status() != Compilation.Status.SUCCESS) {
            throw new AssertionError("Compilation failed: " + compilation.diagnostics());
        }

        return new RuntimeTestHelper(compilation);
    }

    /**
     * Invokes a static method on the specified class. Each argument must be an instance of the
     * corresponding declared parameter type.
     *
     * @param className  fully qualified class name
     * @param methodName method to invoke
     * @param args       method arguments
     * @return the method's return value (null for void methods)
     */
    public Object invoke(String className, String methodName, Object... args) {
        try {
            Class<?> clazz = loadClass(className);
            Method method = findMethod(clazz, methodName, args);
            return method.invoke(null, args);
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to invoke " + className + "." + methodName, e);
        }
    }

    /**
     * Invokes a static {@code void method(PrintStream)} and returns what it printed.
     *
     * @param className  fully qualified class name
     * @param methodName method to invoke
     * @return the printed text
     */
    public String capture(String className, String methodName) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            invoke(className, methodName, out);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * Reads a public static field.
     *
     * @param className fully qualified class name
     * @param fieldName field name
     * @return the field value
     */
    public Object getStaticField(String className, String fieldName) {
        try {
            return loadClass(className).getField(fieldName).get(null);
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to read " + className + "." + fieldName, e);
        }
    }

    /**
     * Loads a class from the compilation output.
     *
     * @param className fully qualified class name
     * @return the loaded class
     */
    public Class<?> loadClass(String className) {
        return loadedClasses.computeIfAbsent(className, name -> {
            try {
                return classLoader.loadClass(name);
            } catch (ClassNotFoundException e) {
                throw new RuntimeException("Class not found: " + name, e);
            }
        });
    }

    /**
     * Returns the underlying compilation for additional assertions.
     */
    public Compilation getCompilation() {
        return compilation;
    }

    private Method findMethod(Class<?> clazz, String name, Object[] args) throws NoSuchMethodException {
        for (Method method : clazz.getDeclaredMethods()) {
            if (!method.getName().equals(name)) continue;
            if (method.getParameterCount() != args.length) continue;

            Class<?>[] paramTypes = method.getParameterTypes();
            boolean matches = true;
            for (int i = 0; i < args.length; i++) {
                if (!paramTypes[i].isInstance(args[i])) {
                    matches = false;
                    break;
                }
            }
            if (matches) {
                return method;
            }
        }

        throw new NoSuchMethodException(clazz.getName() + "." + name + " with " + args.length + " argument(s)");
    }

    /**
     * ClassLoader that loads classes from compilation output.
     */
    private class CompiledClassLoader extends ClassLoader {
        CompiledClassLoader() {
            super(RuntimeTestHelper.class.getClassLoader());
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            String path = name.replace('.', '/') + ".class";

            for (JavaFileObject file : compilation.generatedFiles()) {
                if (file.getKind() == JavaFileObject.Kind.CLASS) {
                    String filePath = file.toUri().getPath();
                    if (filePath.endsWith(path)) {
                        try (InputStream is = file.openInputStream()) {
                            byte[] bytes = is.readAllBytes();
                            return defineClass(name, bytes, 0, bytes.length);
                        } catch (IOException e) {
                            throw new ClassNotFoundException("Failed to load " + name, e);
                        }
                    }
                }
            }

            throw new ClassNotFoundException(name);
        }
    }
}
