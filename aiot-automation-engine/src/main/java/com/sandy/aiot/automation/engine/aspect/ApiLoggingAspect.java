package com.sandy.aiot.automation.engine.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.automation.engine.service.AuditLogService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Logs every operator API call with its arguments, response and duration.
 * Mutating calls (POST, PUT, DELETE) are also written to the audit log.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final Set<String> MUTATING = Set.of("POST", "PUT", "DELETE", "PATCH");

    private final ObjectMapper objectMapper;
    private final AuditLogService auditLogService;

    @Around("within(com.sandy.aiot.automation.engine.controller..*) && !within(com.sandy.aiot.automation.engine.controller.ApiExceptionHandler)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        String query = request != null ? request.getQueryString() : null;

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        Object[] args = pjp.getArgs();
        String[] paramNames = sig.getParameterNames();

        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object a = args[i];
            if (a instanceof HttpServletRequest || a instanceof HttpServletResponse) continue;
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            argMap.put(name, a);
        }

        log.info("API Request: method={} uri={} query={} handler={} args={}", method, uri, query, sig.toShortString(), toJson(argMap));

        Object result = null;
        Throwable error = null;
        try {
            result = pjp.proceed();
            return result;
        } catch (Throwable t) {
            error = t;
            throw t;
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (error == null) {
                if (result instanceof ResponseEntity<?> re) {
                    log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}", method, uri, sig.toShortString(), re.getStatusCode(), cost, toJson(re.getBody()));
                } else {
                    log.info("API Response: method={} uri={} handler={} durationMs={} result={}", method, uri, sig.toShortString(), cost, toJson(result));
                }
            } else {
                log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}", method, uri, sig.toShortString(), cost, error.getClass().getSimpleName(), error.getMessage());
            }
            if (MUTATING.contains(method)) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("method", method);
                details.put("handler", sig.toShortString());
                details.put("args", toJson(argMap));
                details.put("durationMs", cost);
                details.put("outcome", error == null ? "ok" : error.getClass().getSimpleName());
                auditLogService.record("api_call", uri, details);
            }
        }
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            int max = 2000;
            if (s.length() > max) {
                return s.substring(0, max) + "...(" + (s.length() - max) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
