package com.example.blockalert.aspect;

import com.example.blockalert.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.AlertMetricsCollector metricsCollector;

    @Around("@within(com.example.blockalert.aspect.Monitored) || @annotation(com.example.blockalert.aspect.Monitored)")
    public Object monitor(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        Monitored monitored = method.getAnnotation(Monitored.class);
        if (monitored == null) {
            monitored = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String operationType = monitored.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("blockalert." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "success");
            metricsCollector.incrementCounter("blockalert." + operationType + ".calls", "class", className, "method", methodName, "status", "success");
            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("blockalert." + operationType + ".latency", duration, "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("blockalert." + operationType + ".calls", "class", className, "method", methodName, "status", "error");
            metricsCollector.incrementCounter("blockalert.errors", "type", operationType, "class", className, "method", methodName, "exception", e.getClass().getSimpleName());
            log.debug("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }
}
