package io.surfworks.snakeweaver.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every warning in emission order.
 */
public final class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<ConversionWarning> warnings = new ArrayList<>();

    @Override
    public void warn(ConversionWarning warning) {
        warnings.add(warning);
    }

    public List<ConversionWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void clear() {
        warnings.clear();
    }
}
