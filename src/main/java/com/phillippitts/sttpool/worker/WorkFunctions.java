package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.config.stt.VoskConfig;
import com.phillippitts.sttpool.worker.vosk.VoskWorkFunction;

import java.util.Locale;

/**
 * Resolves a configured work-function name to an instance inside the worker process.
 *
 * <p>Accepted names: {@code echo}, {@code vosk}, or the fully-qualified name of a
 * {@link WorkFunction} implementation with a public no-arg constructor.
 */
public final class WorkFunctions {

    private WorkFunctions() {
    }

    /**
     * @throws IllegalArgumentException if the name is blank or the class cannot be instantiated
     */
    public static WorkFunction resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Work function name must not be blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case EchoWorkFunction.NAME -> new EchoWorkFunction();
            case VoskWorkFunction.NAME -> new VoskWorkFunction(VoskConfig.fromSystemProperties());
            default -> instantiate(name.trim());
        };
    }

    private static WorkFunction instantiate(String className) {
        try {
            Class<?> type = Class.forName(className);
            if (!WorkFunction.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " does not implement " + WorkFunction.class.getName());
            }
            return (WorkFunction) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate work function " + className, e);
        }
    }
}
