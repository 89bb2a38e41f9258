package io.hearthwarrio.locatium.core;

import java.util.List;
import java.util.Objects;

/**
 * Default stdout logger for conversions.
 * <p>
 * Prints a single line per conversion, followed by the declarations block when the detail
 * level asks for it.
 */
public final class StdOutConversionLogger implements ConversionLogger {

    private final LogDetail detail;

    public StdOutConversionLogger(LogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logConversion(String xpath, List<Locator> locators, String declarations) {
        System.out.println(format(xpath, locators, declarations));
    }

    String format(String xpath, List<Locator> locators, String declarations) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[Locatium] xpath='").append(safe(xpath)).append('\'')
                .append(", locators=").append(locators == null ? 0 : locators.size());

        if (detail.needsUids() && locators != null) {
            sb.append(", uids=");
            for (int i = 0; i < locators.size(); i++) {
                if (i > 0) {
                    sb.append(" > ");
                }
                sb.append(locators.get(i).getUid());
            }
        }
        if (detail.needsDeclarations()) {
            sb.append('\n').append(declarations == null ? "null" : declarations.stripTrailing());
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
