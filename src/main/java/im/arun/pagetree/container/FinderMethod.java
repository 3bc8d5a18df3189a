package im.arun.pagetree.container;

import im.arun.pagetree.exception.BadMethodCallException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A finder named after the property it matches, such as {@code findByLabel},
 * {@code findOneById} or {@code findAllByClass}.
 */
public final class FinderMethod {
    private static final Pattern FINDER_PATTERN = Pattern.compile("(find(?:One|All)?By)(.+)");

    private final FinderKind kind;
    private final String property;

    private FinderMethod(FinderKind kind, String property) {
        this.kind = kind;
        this.property = property;
    }

    /**
     * Splits a finder name into its kind and property.
     *
     * @param owner      class the finder was invoked on, used in the error message
     * @param methodName name such as {@code findAllByLabel}
     * @throws BadMethodCallException if the name is not a finder name
     */
    public static FinderMethod parse(Class<?> owner, String methodName) {
        Matcher matcher = methodName == null ? null : FINDER_PATTERN.matcher(methodName);
        if (matcher == null || !matcher.matches()) {
            throw new BadMethodCallException(String.format(
                    "Bad method call: Unknown method %s::%s", owner.getName(), methodName));
        }

        FinderKind kind = "findAllBy".equals(matcher.group(1)) ? FinderKind.ALL : FinderKind.ONE;
        return new FinderMethod(kind, decapitalize(matcher.group(2)));
    }

    /**
     * JavaBeans rule: lower the first character unless the first two are both upper case.
     */
    static String decapitalize(String name) {
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1))
                && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    public FinderKind getKind() {
        return kind;
    }

    public String getProperty() {
        return property;
    }
}
