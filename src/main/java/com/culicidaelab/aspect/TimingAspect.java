package com.culicidaelab.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Logs the execution time of {@link Timed} methods and keeps the last duration
 * per thread for response envelopes
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    private static final ThreadLocal<Long> EXECUTION_TIME = new ThreadLocal<>();

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.currentTimeMillis();
        String className = joinPoint.getSignature().getDeclaringType().getSimpleName();
        String operation = timed.value().isEmpty() ? joinPoint.getSignature().getName() : timed.value();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);

            if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{}#{} executed in {}ms", className, operation, duration);
            } else {
                log.debug("{}#{} executed in {}ms", className, operation, duration);
            }
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            EXECUTION_TIME.set(duration);
            log.warn("{}#{} failed after {}ms: {}", className, operation, duration, e.toString());
            throw e;
        }
    }

    /**
     * Last measured duration in milliseconds on this thread, 0 if none; clears it
     */
    public static long getAndClearExecutionTime() {
        Long duration = EXECUTION_TIME.get();
        EXECUTION_TIME.remove();
        return duration != null ? duration : 0L;
    }
}
