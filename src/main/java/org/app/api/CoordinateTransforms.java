package org.app.api;

import org.geometry.RotationMatrix;
import org.geometry.Vector3;
import org.orientation.Orientation;
import org.position.PatientPosition;

/**
 * Entry points relating the gradient (GCS), patient (PCS) and device (DCS) coordinate systems.
 *
 * All methods are pure: they allocate fresh results and keep no state between calls.
 * Angles are in radians; beta is the in-plane angle, clockwise around the partition axis.
 */
public interface CoordinateTransforms {

    /**
     * Classifies a patient-space normal as sagittal, coronal or transversal.
     */
    Orientation classify(Vector3 normal);

    /**
     * @return matrix whose columns are the read, line and partition axes in patient coordinates
     */
    RotationMatrix gradientToPatient(Vector3 normal, double beta);

    RotationMatrix gradientToPatient(double[] normal, double beta);

    RotationMatrix patientToGradient(Vector3 normal, double beta);

    /**
     * @return matrix whose columns are the read, line and partition axes in device coordinates
     */
    RotationMatrix gradientToDevice(Vector3 normal, double beta, PatientPosition position);

    RotationMatrix gradientToDevice(double[] normal, double beta, PatientPosition position);

    RotationMatrix deviceToGradient(Vector3 normal, double beta, PatientPosition position);

    RotationMatrix patientToDevice(PatientPosition position);

    Vector3 patientToDevice(Vector3 v, PatientPosition position);

    RotationMatrix deviceToPatient(PatientPosition position);

    Vector3 deviceToPatient(Vector3 v, PatientPosition position);

    /**
     * Gradient-to-device matrix straight from device-space direction cosines, skipping the
     * patient position. Orientation is the plain dominant axis (no tie tolerance).
     */
    RotationMatrix directionCosinesToDevice(Vector3 directionCosines, double beta);

    RotationMatrix directionCosinesToDevice(double[] directionCosines, double beta);
}
