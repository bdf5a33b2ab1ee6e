package com.chicu.simorch.simulator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Фильтр для свободных "extra" флагов пользователя.
 * Ничего не бросает: подозрительные аргументы просто выкидываются с warn.
 */
@Slf4j
@Component
public class ArgumentSanitizer {

    /**
     * --flag или --flag=value; flag: строчная буква, затем [a-z0-9-];
     * value: буквы/цифры и . - + (экспонента 1e-17 проходит).
     */
    static final Pattern ALLOWED = Pattern.compile("^--[a-z][a-z0-9-]*(?:=[A-Za-z0-9.+\\-]+)?$");

    public List<String> sanitize(List<String> args) {
        if (args == null || args.isEmpty()) return List.of();

        List<String> ok = new ArrayList<>(args.size());
        for (String arg : args) {
            if (isAllowed(arg)) {
                ok.add(arg);
            } else {
                log.warn("⚠️ Skipping suspicious extra arg: {}", shrink(arg));
            }
        }
        return List.copyOf(ok);
    }

    public boolean isAllowed(String arg) {
        return arg != null && ALLOWED.matcher(arg).matches();
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        return s.length() <= 120 ? s : s.substring(0, 120) + "...";
    }
}
