package org.position;

import org.geometry.RotationMatrix;
import org.geometry.Vector3;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps between the patient coordinate system and the device coordinate system.
 *
 * Every position is a signed permutation, so the matrices are exact (entries 0 and ±1)
 * and the inverse is the transpose.
 */
public final class PatientDeviceMapper {

    private static final Map<PatientPosition, RotationMatrix> PATIENT_TO_DEVICE = buildTable();

    private static Map<PatientPosition, RotationMatrix> buildTable() {
        Map<PatientPosition, RotationMatrix> table = new EnumMap<>(PatientPosition.class);
        for (PatientPosition p : PatientPosition.values()) {
            double[][] rows = new double[3][3];
            for (int d = 0; d < 3; d++) {
                SignedAxis a = p.deviceAxis(d);
                rows[d][a.patientAxis()] = a.sign();
            }
            table.put(p, RotationMatrix.of(rows));
        }
        return table;
    }

    public RotationMatrix patientToDevice(PatientPosition position) {
        return PATIENT_TO_DEVICE.get(requirePosition(position));
    }

    public RotationMatrix deviceToPatient(PatientPosition position) {
        return patientToDevice(position).transpose();
    }

    /**
     * Expresses a patient-space vector in device coordinates.
     */
    public Vector3 patientToDevice(Vector3 v, PatientPosition position) {
        requireVector(v);
        requirePosition(position);
        double[] out = new double[3];
        for (int d = 0; d < 3; d++) {
            SignedAxis a = position.deviceAxis(d);
            out[d] = a.sign() * v.get(a.patientAxis());
        }
        return Vector3.of(out);
    }

    /**
     * Expresses a device-space vector in patient coordinates.
     */
    public Vector3 deviceToPatient(Vector3 v, PatientPosition position) {
        requireVector(v);
        requirePosition(position);
        double[] out = new double[3];
        for (int d = 0; d < 3; d++) {
            SignedAxis a = position.deviceAxis(d);
            out[a.patientAxis()] = a.sign() * v.get(d);
        }
        return Vector3.of(out);
    }

    private static PatientPosition requirePosition(PatientPosition position) {
        if (position == null) {
            throw new IllegalArgumentException("position must not be null");
        }
        return position;
    }

    private static void requireVector(Vector3 v) {
        if (v == null) {
            throw new IllegalArgumentException("v must not be null");
        }
    }
}
