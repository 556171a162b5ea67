package com.bbthechange.bridge.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders ghost display names from LinkedIn profile name fields.
 *
 * The {@code displayname} field is filled with the first non-empty field named in the preference
 * list, then the template is rendered. Templates may reference {@code {displayname}}, {@code {name}},
 * {@code {first_name}} and {@code {last_name}}; missing values render as empty text.
 */
public class DisplaynameFormatter {

    public static final String DISPLAYNAME = "displayname";
    public static final String NAME = "name";
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";

    private static final Set<String> FIELDS = Set.of(DISPLAYNAME, NAME, FIRST_NAME, LAST_NAME);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

    private final List<String> preference;
    private final String template;

    public DisplaynameFormatter(List<String> preference, String template) {
        if (template == null) {
            throw new IllegalArgumentException("Displayname template must be set");
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            if (!FIELDS.contains(matcher.group(1))) {
                throw new IllegalArgumentException("Unknown displayname template field: " + matcher.group(0));
            }
        }
        this.preference = List.copyOf(preference);
        this.template = template;
    }

    public String format(String firstName, String lastName) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(DISPLAYNAME, null);
        fields.put(NAME, composite(firstName, lastName));
        fields.put(FIRST_NAME, firstName);
        fields.put(LAST_NAME, lastName);

        for (String field : preference) {
            String value = fields.get(field);
            if (value != null && !value.isEmpty()) {
                fields.put(DISPLAYNAME, value);
                break;
            }
        }
        return render(fields);
    }

    private String render(Map<String, String> fields) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = fields.get(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(result);
        return result.toString().trim();
    }

    private static String composite(String firstName, String lastName) {
        String name = Stream.of(firstName, lastName)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining(" "));
        return name.isEmpty() ? null : name;
    }
}
