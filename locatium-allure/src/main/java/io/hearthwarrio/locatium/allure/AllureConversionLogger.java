package io.hearthwarrio.locatium.allure;

import io.hearthwarrio.locatium.core.ConversionLogger;
import io.hearthwarrio.locatium.core.Locator;
import io.hearthwarrio.locatium.core.LogDetail;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Allure logger for conversions.
 * <p>
 * Lives in locatium-allure to avoid leaking Allure dependency into core.
 * <p>
 * Each conversion becomes an Allure step with a text attachment; with
 * {@link LogDetail#DECLARATIONS} or {@link LogDetail#BOTH} the rendered declarations are
 * attached as a second file.
 */
public final class AllureConversionLogger implements ConversionLogger {

    private final LogDetail detail;

    public AllureConversionLogger(LogDetail detail) {
        this.detail = detail == null ? LogDetail.NONE : detail;
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logConversion(String xpath, List<Locator> locators, String declarations) {
        String title = "Locatium: " + safe(xpath) + " – " + (locators == null ? 0 : locators.size()) + " locator(s)";

        Allure.step(title, () -> {
            attach("Conversion", summary(xpath, locators), ".txt");
            if (detail.needsDeclarations() && declarations != null) {
                attach("Declarations", declarations, ".py");
            }
        });
    }

    String summary(String xpath, List<Locator> locators) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("xpath: ").append(safe(xpath)).append('\n')
                .append("locators: ").append(locators == null ? 0 : locators.size()).append('\n');

        if (detail.needsUids() && locators != null) {
            for (Locator l : locators) {
                sb.append("uid: ").append(l.getUid());
                l.getContainerUid().ifPresent(c -> sb.append(" (container: ").append(c).append(')'));
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static void attach(String name, String text, String extension) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(name, "text/plain", new ByteArrayInputStream(bytes), extension);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
