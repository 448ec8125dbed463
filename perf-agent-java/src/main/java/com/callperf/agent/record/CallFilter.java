package com.callperf.agent.record;

import com.callperf.agent.config.PerfConfig;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a qualified name is eligible for recording.
 *
 * Module rules match the class part of the name: a rule matches when it equals the module,
 * is a package prefix of it ("java.util" matches "java.util.ArrayList"), or is a regex that
 * matches the whole module. Function rules are regexes searched in the method part.
 * Excludes win over includes; an empty include list admits everything.
 */
public final class CallFilter {

    private final List<ModuleRule> excludeModules;
    private final List<ModuleRule> includeModules;
    private final List<Pattern> excludeFunctions;
    private final List<Pattern> includeFunctions;

    // qualified name -> verdict; names are few and calls are many
    private final ConcurrentHashMap<String, Boolean> verdicts = new ConcurrentHashMap<>();

    public CallFilter(PerfConfig.Filters filters) {
        this.excludeModules = filters.getExcludeModules().stream().map(ModuleRule::new).toList();
        this.includeModules = filters.getIncludeModules().stream().map(ModuleRule::new).toList();
        this.excludeFunctions = filters.getExcludeFunctions().stream().map(CallFilter::compile).toList();
        this.includeFunctions = filters.getIncludeFunctions().stream().map(CallFilter::compile).toList();
    }

    public boolean accepts(String qualifiedName) {
        return verdicts.computeIfAbsent(qualifiedName, this::evaluate);
    }

    private boolean evaluate(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        String module = dot < 0 ? "" : qualifiedName.substring(0, dot);
        String function = dot < 0 ? qualifiedName : qualifiedName.substring(dot + 1);

        for (ModuleRule rule : excludeModules) {
            if (rule.matches(module)) return false;
        }
        if (!includeModules.isEmpty() && includeModules.stream().noneMatch(r -> r.matches(module))) {
            return false;
        }
        for (Pattern p : excludeFunctions) {
            if (p.matcher(function).find()) return false;
        }
        return includeFunctions.isEmpty()
            || includeFunctions.stream().anyMatch(p -> p.matcher(function).find());
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            return Pattern.compile(Pattern.quote(regex));
        }
    }

    private static final class ModuleRule {
        private final String name;
        private final Pattern pattern;

        ModuleRule(String name) {
            this.name = name;
            this.pattern = compile(name);
        }

        boolean matches(String module) {
            return module.equals(name)
                || module.startsWith(name + ".")
                || pattern.matcher(module).matches();
        }
    }
}
