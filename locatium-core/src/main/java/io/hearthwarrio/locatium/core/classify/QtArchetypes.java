package io.hearthwarrio.locatium.core.classify;

/**
 * Category labels produced by {@link HeuristicQtClassifier}.
 */
public final class QtArchetypes {

    public static final String PUSH_BUTTON = "PushButtonQT";
    public static final String SCROLL_VIEW = "ScrollViewQT";
    public static final String MODULE = "ModuleQT";
    public static final String TEXT_FIELD = "TextFieldQT";
    public static final String CHECK_BOX = "CheckBoxQT";
    public static final String RADIO_BUTTON = "RadioButtonQT";
    public static final String COMBO_BOX = "ComboBoxQT";
    public static final String SLIDER = "SliderQT";
    public static final String LABEL = "LabelQT";
    public static final String WIDGET = "QWidget";

    private QtArchetypes() {
        // constants
    }
}
