package com.entity.extraction.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled regular expression with a name used for traceability.
 * Named capture groups ({@code (?<Table>...)}) are recorded so their values can be
 * copied onto the entity as attributes.
 */
public final class NamedPattern {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final String name;
    private final Pattern pattern;
    private final List<String> groupNames;

    private NamedPattern(String name, Pattern pattern) {
        this.name = name;
        this.pattern = pattern;
        this.groupNames = Collections.unmodifiableList(findGroupNames(pattern.pattern()));
    }

    /**
     * Compiles a named pattern.
     *
     * @throws IllegalArgumentException if the name or regex is blank, or the regex is invalid
     */
    public static NamedPattern of(String name, String regex, int flags) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("patternName must not be null or blank");
        }
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be null or empty");
        }
        try {
            return new NamedPattern(name, Pattern.compile(regex, flags));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid regex pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    public static NamedPattern of(String name, String regex) {
        return of(name, regex, 0);
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public List<String> getGroupNames() {
        return groupNames;
    }

    public Matcher matcher(CharSequence input) {
        return pattern.matcher(input);
    }

    private static List<String> findGroupNames(String regex) {
        List<String> names = new ArrayList<>();
        Matcher m = GROUP_NAME.matcher(regex);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NamedPattern that = (NamedPattern) o;
        return name.equals(that.name) && pattern.pattern().equals(that.pattern.pattern());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pattern.pattern());
    }

    @Override
    public String toString() {
        return "NamedPattern{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                '}';
    }
}
