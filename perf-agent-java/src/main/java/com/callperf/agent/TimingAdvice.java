package com.callperf.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

/**
 * ByteBuddy advice inlined into every instrumented method.
 *
 * Qualified name format: {@code <fully-qualified-class-name>.<method-name>}.
 * The advice only calls public static entry points on {@link PerfAgent}: inlined bytecode
 * runs in the instrumented class's loader and package, so it must not touch non-public types.
 */
public class TimingAdvice {

    @Advice.OnMethodEnter
    public static Object onEnter(
            @Advice.Origin("#t.#m") String qualifiedName,
            @Advice.AllArguments(readOnly = true, typing = Assigner.Typing.DYNAMIC) Object[] args) {
        return PerfAgent.enter(qualifiedName, args);
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(
            @Advice.Enter Object measurement,
            @Advice.Thrown Throwable thrown) {
        PerfAgent.exit(measurement, thrown);
    }
}
