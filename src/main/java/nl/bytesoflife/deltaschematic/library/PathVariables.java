package nl.bytesoflife.deltaschematic.library;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code ${NAME}} references in library URIs. Explicit variables win over the environment;
 * unknown references are left in place.
 */
public class PathVariables {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{([^}]+)}");

    private final Map<String, String> variables;
    private final Function<String, String> environment;

    public PathVariables(Map<String, String> variables) {
        this(variables, System::getenv);
    }

    public PathVariables(Map<String, String> variables, Function<String, String> environment) {
        this.variables = new LinkedHashMap<>(variables);
        this.environment = environment;
    }

    public String expand(String uri) {
        Matcher matcher = REFERENCE.matcher(uri);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = lookup(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    public String lookup(String name) {
        String value = variables.get(name);
        return value != null ? value : environment.apply(name);
    }

    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(variables);
    }
}
