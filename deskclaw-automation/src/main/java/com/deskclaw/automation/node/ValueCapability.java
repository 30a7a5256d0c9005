package com.deskclaw.automation.node;

/**
 * Read side of a node holding a textual value (edit fields, spinners, combo boxes).
 */
public interface ValueCapability {

    Readout<String> value();

    Readout<Boolean> isReadOnly();

    static ValueCapability of(String value, boolean readOnly) {
        return new ValueCapability() {
            @Override
            public Readout<String> value() {
                return Readout.of(value);
            }

            @Override
            public Readout<Boolean> isReadOnly() {
                return Readout.of(readOnly);
            }
        };
    }
}
