package org.app.service;

import org.app.api.CoordinateTransforms;
import org.geometry.ElementaryRotations;
import org.geometry.RotationMatrix;
import org.geometry.Vector3;
import org.gradient.GradientBasisBuilder;
import org.gradient.LineAxisConvention;
import org.orientation.Orientation;
import org.orientation.OrientationClassifier;
import org.position.PatientDeviceMapper;
import org.position.PatientPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Default {@link CoordinateTransforms}: classifier, basis builder and axis mapper chained together.
 *
 * Gradient-to-device classifies the normal in patient space, builds the gradient-to-patient
 * basis and then maps it with the patient position. The orientation is therefore the one an
 * operator sees in patient terms, independent of how the patient lies on the table.
 */
public final class CoordinateTransformService implements CoordinateTransforms {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoordinateTransformService.class);

    private final OrientationClassifier classifier;
    private final GradientBasisBuilder basisBuilder;
    private final PatientDeviceMapper mapper;

    public CoordinateTransformService() {
        this(new OrientationClassifier(), new GradientBasisBuilder(), new PatientDeviceMapper());
    }

    public CoordinateTransformService(OrientationClassifier classifier,
                                      GradientBasisBuilder basisBuilder,
                                      PatientDeviceMapper mapper) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.basisBuilder = Objects.requireNonNull(basisBuilder, "basisBuilder must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Orientation classify(Vector3 normal) {
        return classifier.classify(normal);
    }

    @Override
    public RotationMatrix gradientToPatient(Vector3 normal, double beta) {
        Orientation orientation = classifier.classify(normal);
        return basisBuilder.buildBasis(normal, orientation, beta);
    }

    @Override
    public RotationMatrix gradientToPatient(double[] normal, double beta) {
        return gradientToPatient(Vector3.of(normal), beta);
    }

    @Override
    public RotationMatrix patientToGradient(Vector3 normal, double beta) {
        return gradientToPatient(normal, beta).transpose();
    }

    @Override
    public RotationMatrix gradientToDevice(Vector3 normal, double beta, PatientPosition position) {
        requirePosition(position);
        RotationMatrix gcsToPcs = gradientToPatient(normal, beta);
        RotationMatrix gcsToDcs = mapper.patientToDevice(position).multiply(gcsToPcs);
        LOGGER.debug("gradientToDevice normal={} beta={} position={} -> {}", normal, beta, position, gcsToDcs);
        return gcsToDcs;
    }

    @Override
    public RotationMatrix gradientToDevice(double[] normal, double beta, PatientPosition position) {
        return gradientToDevice(Vector3.of(normal), beta, position);
    }

    @Override
    public RotationMatrix deviceToGradient(Vector3 normal, double beta, PatientPosition position) {
        return gradientToDevice(normal, beta, position).transpose();
    }

    @Override
    public RotationMatrix patientToDevice(PatientPosition position) {
        return mapper.patientToDevice(position);
    }

    @Override
    public Vector3 patientToDevice(Vector3 v, PatientPosition position) {
        return mapper.patientToDevice(v, position);
    }

    @Override
    public RotationMatrix deviceToPatient(PatientPosition position) {
        return mapper.deviceToPatient(position);
    }

    @Override
    public Vector3 deviceToPatient(Vector3 v, PatientPosition position) {
        return mapper.deviceToPatient(v, position);
    }

    @Override
    public RotationMatrix directionCosinesToDevice(Vector3 directionCosines, double beta) {
        Orientation orientation = classifier.dominantAxis(directionCosines);
        RotationMatrix basis = basisBuilder.buildBasis(directionCosines, orientation, LineAxisConvention.DEVICE);
        RotationMatrix rotated = basis.multiply(ElementaryRotations.rz(beta));
        LOGGER.debug("directionCosinesToDevice dc={} beta={} orientation={} -> {}",
                directionCosines, beta, orientation, rotated);
        return rotated;
    }

    @Override
    public RotationMatrix directionCosinesToDevice(double[] directionCosines, double beta) {
        return directionCosinesToDevice(Vector3.of(directionCosines), beta);
    }

    private static void requirePosition(PatientPosition position) {
        if (position == null) {
            throw new IllegalArgumentException("position must not be null");
        }
    }
}
