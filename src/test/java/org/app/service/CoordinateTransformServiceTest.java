package org.app.service;

import org.app.api.CoordinateTransforms;
import org.geometry.ElementaryRotations;
import org.geometry.RotationMatrix;
import org.geometry.Vector3;
import org.gradient.DegenerateOrientationException;
import org.gradient.GradientBasisBuilder;
import org.gradient.LineAxisConvention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.orientation.Orientation;
import org.position.PatientPosition;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateTransformServiceTest {

    private static final double TOL = 1e-9;

    private final CoordinateTransforms transforms = new CoordinateTransformService();

    /** Slightly tilted sagittal slice: 5 deg towards coronal, 10 deg towards transversal. */
    private static Vector3 tiltedSagittal() {
        double cor = Math.cos(Math.toRadians(95.0));
        double tra = Math.cos(Math.toRadians(100.0));
        double sag = Math.sqrt(1.0 - cor * cor - tra * tra);
        return Vector3.of(sag, cor, tra).normalized();
    }

    @Nested
    class GradientToDevice {

        @Test
        @DisplayName("tilted sagittal, head first supine, beta=10 deg")
        void endToEnd_headFirstSupine() {
            Vector3 normal = tiltedSagittal();
            assertEquals(Orientation.SAGITTAL, transforms.classify(normal));

            RotationMatrix r = transforms.gradientToDevice(normal, Math.toRadians(10.0),
                    PatientPosition.HEAD_FIRST_SUPINE);

            assertTrue(r.isOrthonormal(TOL));
            assertTrue(r.isRightHanded(TOL));
            Vector3 expectedPartition = transforms.patientToDevice(normal, PatientPosition.HEAD_FIRST_SUPINE);
            assertTrue(r.column(2).equalsWithin(expectedPartition, 1e-12));
        }

        @ParameterizedTest
        @EnumSource(PatientPosition.class)
        @DisplayName("gradientToDevice = patientToDevice(pos) * gradientToPatient")
        void composesPatientMapping(PatientPosition position) {
            Vector3 normal = Vector3.of(0.3, -0.5, 0.8).normalized();
            double beta = 0.4;
            RotationMatrix expected = transforms.patientToDevice(position)
                    .multiply(transforms.gradientToPatient(normal, beta));
            RotationMatrix actual = transforms.gradientToDevice(normal, beta, position);
            assertTrue(actual.equalsWithin(expected, 0.0));
            assertTrue(actual.isRightHanded(TOL));
        }

        @ParameterizedTest
        @EnumSource(PatientPosition.class)
        void deviceToGradient_isInverse(PatientPosition position) {
            Vector3 normal = Vector3.of(-0.2, 0.9, 0.1).normalized();
            RotationMatrix forward = transforms.gradientToDevice(normal, -0.7, position);
            RotationMatrix inverse = transforms.deviceToGradient(normal, -0.7, position);
            assertTrue(forward.multiply(inverse).equalsWithin(RotationMatrix.identity(), TOL));
        }

        @Test
        void arrayOverload_checksLength() {
            assertThrows(IllegalArgumentException.class,
                    () -> transforms.gradientToDevice(new double[]{1, 0}, 0.0, PatientPosition.FEET_FIRST_PRONE));
            RotationMatrix r = transforms.gradientToDevice(new double[]{0.9, 0.1, 0.2}, 0.0,
                    PatientPosition.FEET_FIRST_PRONE);
            assertTrue(r.isRightHanded(TOL));
        }

        @Test
        void nullPositionThrows() {
            assertThrows(IllegalArgumentException.class,
                    () -> transforms.gradientToDevice(tiltedSagittal(), 0.0, null));
        }
    }

    @Nested
    class GradientToPatient {

        @Test
        void usesClassifiedOrientation() {
            Vector3 normal = Vector3.of(0.1, 0.2, 0.97).normalized();
            RotationMatrix expected = new GradientBasisBuilder().buildBasis(normal, Orientation.TRANSVERSAL, 0.25);
            assertTrue(transforms.gradientToPatient(normal, 0.25).equalsWithin(expected, 0.0));
        }

        @Test
        void patientToGradient_mapsPartitionToThirdAxis() {
            Vector3 normal = Vector3.of(0.6, 0.75, 0.1).normalized();
            Vector3 g = transforms.patientToGradient(normal, 1.3).apply(normal);
            assertTrue(g.equalsWithin(Vector3.of(0, 0, 1), TOL));
        }

        @Test
        @DisplayName("exact axial normal lands in the sag=cor tie rule and fails as degenerate, never NaN")
        void exactAxialNormal_failsExplicitly() {
            Vector3 axial = Vector3.of(0, 0, 1);
            assertEquals(Orientation.CORONAL, transforms.classify(axial));
            assertThrows(DegenerateOrientationException.class, () -> transforms.gradientToPatient(axial, 0.0));
        }

        @Test
        @DisplayName("very large and very small non-unit normals are re-normalized, not rejected")
        void extremeMagnitudeNormals() {
            RotationMatrix huge = transforms.gradientToPatient(Vector3.of(1e200, 1e200, 3e200), 0.0);
            RotationMatrix unit = transforms.gradientToPatient(Vector3.of(1, 1, 3), 0.0);
            assertTrue(huge.isOrthonormal(TOL));
            assertTrue(huge.isRightHanded(TOL));
            assertTrue(huge.equalsWithin(unit, 1e-12));

            RotationMatrix tiny = transforms.gradientToPatient(Vector3.of(1e-170, 1e-170, 1e-170), 0.3);
            RotationMatrix reference = transforms.gradientToPatient(Vector3.of(1, 1, 1), 0.3);
            assertTrue(tiny.isOrthonormal(TOL));
            assertTrue(tiny.equalsWithin(reference, 1e-12));
        }

        @Test
        void zeroNormalThrows() {
            assertThrows(IllegalArgumentException.class,
                    () -> transforms.gradientToPatient(Vector3.of(0, 0, 0), 0.0));
        }
    }

    @Nested
    class PatientDevice {

        @ParameterizedTest
        @EnumSource(PatientPosition.class)
        void deviceToPatient_isTransposeLookup(PatientPosition position) {
            assertEquals(transforms.patientToDevice(position).transpose(), transforms.deviceToPatient(position));
        }

        @Test
        void vectorForms_roundTrip() {
            Vector3 v = Vector3.of(0.3, -0.4, 0.5);
            Vector3 d = transforms.patientToDevice(v, PatientPosition.HEAD_FIRST_LATERAL_LEFT);
            assertEquals(v, transforms.deviceToPatient(d, PatientPosition.HEAD_FIRST_LATERAL_LEFT));
        }
    }

    @Nested
    class DirectionCosinesToDevice {

        @Test
        @DisplayName("partition column is the normalized direction cosines; result is right-handed")
        void partitionAndHandedness() {
            Vector3 dc = Vector3.of(0.1, 0.95, -0.3);
            RotationMatrix r = transforms.directionCosinesToDevice(dc, Math.toRadians(20.0));
            assertTrue(r.column(2).equalsWithin(dc.normalized(), 1e-12));
            assertTrue(r.isOrthonormal(TOL));
            assertTrue(r.isRightHanded(TOL));
        }

        @Test
        @DisplayName("beta is applied as basis * R_z(beta), same as the in-plane rotation")
        void betaComposition() {
            Vector3 dc = Vector3.of(-0.2, 0.3, 0.93);
            double beta = 0.6;
            RotationMatrix unrotated = transforms.directionCosinesToDevice(dc, 0.0);
            RotationMatrix rotated = transforms.directionCosinesToDevice(dc, beta);
            assertTrue(rotated.equalsWithin(unrotated.multiply(ElementaryRotations.rz(beta)), 1e-12));
            assertTrue(rotated.equalsWithin(new GradientBasisBuilder().rotateInPlane(unrotated, beta), 1e-12));
        }

        @Test
        @DisplayName("uses the device sign convention and the tolerance-free dominant axis")
        void deviceConventionAndDominantAxis() {
            Vector3 dc = Vector3.of(1, 1, 0); // exact tie: sagittal wins
            RotationMatrix r = transforms.directionCosinesToDevice(dc, 0.0);
            RotationMatrix expected = new GradientBasisBuilder()
                    .buildBasis(dc, Orientation.SAGITTAL, LineAxisConvention.DEVICE);
            assertTrue(r.equalsWithin(expected, 1e-12));
            assertEquals(0.0, r.get(2, 1), 1e-12);
        }

        @Test
        void wrongLengthThrows() {
            assertThrows(IllegalArgumentException.class,
                    () -> transforms.directionCosinesToDevice(new double[]{1, 0, 0, 0}, 0.0));
        }
    }
}
