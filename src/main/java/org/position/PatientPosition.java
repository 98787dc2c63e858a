package org.position;

import java.util.Locale;

/**
 * The 8 standard patient-table positions.
 *
 * Each position fixes how the patient axes (sag, cor, tra) line up with the device
 * gradient axes (x, y, z). The table is data; {@link PatientDeviceMapper} turns it into matrices.
 */
public enum PatientPosition {

    //                                 device x            device y            device z
    HEAD_FIRST_SUPINE("HFS",        SignedAxis.plus(0),  SignedAxis.minus(1), SignedAxis.minus(2)),
    HEAD_FIRST_PRONE("HFP",         SignedAxis.minus(0), SignedAxis.plus(1),  SignedAxis.minus(2)),
    HEAD_FIRST_LATERAL_RIGHT("HFLR", SignedAxis.plus(1),  SignedAxis.plus(0),  SignedAxis.minus(2)),
    HEAD_FIRST_LATERAL_LEFT("HFLL",  SignedAxis.minus(1), SignedAxis.minus(0), SignedAxis.minus(2)),
    FEET_FIRST_SUPINE("FFS",        SignedAxis.minus(0), SignedAxis.minus(1), SignedAxis.plus(2)),
    FEET_FIRST_PRONE("FFP",         SignedAxis.plus(0),  SignedAxis.plus(1),  SignedAxis.plus(2)),
    FEET_FIRST_LATERAL_RIGHT("FFLR", SignedAxis.minus(1), SignedAxis.plus(0),  SignedAxis.plus(2)),
    FEET_FIRST_LATERAL_LEFT("FFLL",  SignedAxis.plus(1),  SignedAxis.minus(0), SignedAxis.plus(2));

    private final String code;
    private final SignedAxis[] deviceAxes;

    PatientPosition(String code, SignedAxis x, SignedAxis y, SignedAxis z) {
        this.code = code;
        this.deviceAxes = new SignedAxis[]{x, y, z};
    }

    /**
     * @return the short code, e.g. "HFS"
     */
    public String code() {
        return code;
    }

    /**
     * @param deviceAxis 0 = x, 1 = y, 2 = z
     * @return which signed patient axis feeds the given device axis
     */
    public SignedAxis deviceAxis(int deviceAxis) {
        if (deviceAxis < 0 || deviceAxis > 2) {
            throw new IndexOutOfBoundsException("deviceAxis=" + deviceAxis + ", dim=3");
        }
        return deviceAxes[deviceAxis];
    }

    public boolean isHeadFirst() {
        return code.startsWith("HF");
    }

    /**
     * Resolves a short code such as "HFS" or " ffp ". Surrounding spaces and case are ignored.
     *
     * @throws IllegalArgumentException if the code is blank or unknown
     */
    public static PatientPosition fromCode(String rawCode) {
        if (rawCode == null || rawCode.isBlank()) {
            throw new IllegalArgumentException("patient position code must be non-empty");
        }
        String canonical = rawCode.strip().toUpperCase(Locale.ROOT);
        for (PatientPosition p : values()) {
            if (p.code.equals(canonical)) return p;
        }
        throw new IllegalArgumentException("Unknown patient position code: " + rawCode);
    }
}
