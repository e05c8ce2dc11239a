package com.hartwig.minijd.pathmapping;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites paths from the submitting host to the host that executes the job. The rule with the longest matching source path
 * wins, ties go to the rule listed first.
 */
public class PathMapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(PathMapper.class);

    private final List<PathMappingRule> rules;
    private final List<CompiledRule> rulesByPrecedence;
    private final PathFormat destinationFormat;

    public PathMapper(final List<PathMappingRule> rules, final PathFormat destinationFormat) {
        this.rules = List.copyOf(rules);
        this.destinationFormat = destinationFormat;
        var compiled = new ArrayList<CompiledRule>();
        for (int i = 0; i < rules.size(); i++) {
            compiled.add(compile(i, rules.get(i)));
        }
        // stable sort, so equally long source paths keep their list order
        compiled.sort(Comparator.comparingInt((CompiledRule rule) -> rule.sourceParts.size()).reversed());
        this.rulesByPrecedence = List.copyOf(compiled);
    }

    public static PathMapper forHost(List<PathMappingRule> rules) {
        return new PathMapper(rules, PathFormat.host());
    }

    public static PathMapper none() {
        return new PathMapper(List.of(), PathFormat.host());
    }

    public String translate(String path) {
        return translate(path, PathFormat.infer(path));
    }

    /**
     * Maps a path written in the given convention. Paths outside every rule are returned unchanged.
     */
    public String translate(String path, PathFormat sourceFormat) {
        if (StringUtils.isEmpty(path)) {
            return path;
        }
        var parts = split(path, sourceFormat);
        for (CompiledRule rule : rulesByPrecedence) {
            if (rule.rule.sourcePathFormat() == sourceFormat && isPrefix(rule.sourceParts, parts, sourceFormat)) {
                var mapped = join(rule.rule.destinationPath(), parts.subList(rule.sourceParts.size(), parts.size()));
                LOGGER.debug("Mapped path '{}' to '{}' using rule {}", path, mapped, rule.index);
                return mapped;
            }
        }
        return path;
    }

    public Optional<PathMappingRule> findRule(String path) {
        var sourceFormat = PathFormat.infer(path);
        var parts = split(path, sourceFormat);
        return rulesByPrecedence.stream()
                .filter(rule -> rule.rule.sourcePathFormat() == sourceFormat && isPrefix(rule.sourceParts, parts, sourceFormat))
                .map(rule -> rule.rule)
                .findFirst();
    }

    public List<PathMappingRule> getRules() {
        return rules;
    }

    public boolean hasRules() {
        return !rules.isEmpty();
    }

    public PathFormat getDestinationFormat() {
        return destinationFormat;
    }

    private String join(String destination, List<String> remainder) {
        var separator = destinationFormat.getSeparator();
        var base = stripTrailingSeparators(destination);
        if (remainder.isEmpty()) {
            return base;
        }
        var builder = new StringBuilder(base);
        if (base.isEmpty() || base.charAt(base.length() - 1) != separator) {
            builder.append(separator);
        }
        builder.append(String.join(String.valueOf(separator), remainder));
        return builder.toString();
    }

    private String stripTrailingSeparators(String destination) {
        var end = destination.length();
        while (end > 1 && destinationFormat.isSeparator(destination.charAt(end - 1))) {
            end--;
        }
        var stripped = destination.substring(0, end);
        // keep the separator of a bare drive root such as C:\
        if (destinationFormat == PathFormat.WINDOWS && stripped.matches("^[A-Za-z]:$") && destination.length() > end) {
            return stripped + destinationFormat.getSeparator();
        }
        return stripped;
    }

    private static boolean isPrefix(List<String> prefix, List<String> parts, PathFormat format) {
        if (prefix.size() > parts.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            var matches = format == PathFormat.WINDOWS ? prefix.get(i).equalsIgnoreCase(parts.get(i)) : prefix.get(i).equals(parts.get(i));
            if (!matches) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits a path into its root followed by its components. The root is "/" for absolute POSIX paths, the drive ("C:") or the
     * UNC server ("\\server") for WINDOWS paths.
     */
    static List<String> split(String path, PathFormat format) {
        var parts = new ArrayList<String>();
        int position = 0;
        if (format == PathFormat.POSIX && path.startsWith("/")) {
            parts.add("/");
        } else if (format == PathFormat.WINDOWS && (path.startsWith("\\\\") || path.startsWith("//"))) {
            int end = 2;
            while (end < path.length() && !format.isSeparator(path.charAt(end))) {
                end++;
            }
            parts.add("\\\\" + path.substring(2, end));
            position = end;
        }
        var current = new StringBuilder();
        for (int i = position; i < path.length(); i++) {
            var c = path.charAt(i);
            if (format.isSeparator(c)) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    private static CompiledRule compile(int index, PathMappingRule rule) {
        if (rule.sourcePathFormat() == null) {
            throw new PathMappingException(String.format("Path mapping rule %d has no source path format", index));
        }
        if (StringUtils.isBlank(rule.sourcePath())) {
            throw new PathMappingException(String.format("Path mapping rule %d has an empty source path", index));
        }
        if (!rule.sourcePathFormat().isAbsolute(rule.sourcePath())) {
            throw new PathMappingException(String.format("Path mapping rule %d has source path '%s' that is not an absolute %s path",
                    index,
                    rule.sourcePath(),
                    rule.sourcePathFormat()));
        }
        if (StringUtils.isBlank(rule.destinationPath())) {
            throw new PathMappingException(String.format("Path mapping rule %d has an empty destination path", index));
        }
        return new CompiledRule(index, rule, split(rule.sourcePath(), rule.sourcePathFormat()));
    }

    private static final class CompiledRule {
        private final int index;
        private final PathMappingRule rule;
        private final List<String> sourceParts;

        private CompiledRule(final int index, final PathMappingRule rule, final List<String> sourceParts) {
            this.index = index;
            this.rule = rule;
            this.sourceParts = sourceParts;
        }
    }
}
