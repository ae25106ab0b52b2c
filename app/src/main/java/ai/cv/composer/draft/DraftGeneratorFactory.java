package ai.cv.composer.draft;

import java.util.Objects;

/**
 * Provides draft generators and CV advisors based on the desired execution mode.
 */
public class DraftGeneratorFactory {

    private final DraftGenerator productionGenerator;
    private final DraftGenerator passThroughGenerator;
    private final DraftGenerator mockGenerator;
    private final CvAdvisor productionAdvisor;
    private final CvAdvisor mockAdvisor;

    public DraftGeneratorFactory(DraftGenerator productionGenerator,
                                 DraftGenerator passThroughGenerator,
                                 DraftGenerator mockGenerator,
                                 CvAdvisor productionAdvisor,
                                 CvAdvisor mockAdvisor) {
        this.productionGenerator = Objects.requireNonNull(productionGenerator, "productionGenerator");
        this.passThroughGenerator = Objects.requireNonNull(passThroughGenerator, "passThroughGenerator");
        this.mockGenerator = Objects.requireNonNull(mockGenerator, "mockGenerator");
        this.productionAdvisor = Objects.requireNonNull(productionAdvisor, "productionAdvisor");
        this.mockAdvisor = Objects.requireNonNull(mockAdvisor, "mockAdvisor");
    }

    public DraftGenerator select(DraftMode mode) {
        return switch (Objects.requireNonNull(mode, "mode")) {
            case PRODUCTION -> productionGenerator;
            case PASS_THROUGH -> passThroughGenerator;
            case MOCK -> mockGenerator;
        };
    }

    /**
     * Pass-through mode has no advisor: feedback needs a model or the offline mock.
     */
    public CvAdvisor selectAdvisor(DraftMode mode) {
        return switch (Objects.requireNonNull(mode, "mode")) {
            case PRODUCTION -> productionAdvisor;
            case MOCK -> mockAdvisor;
            case PASS_THROUGH -> throw new IllegalArgumentException("CV feedback requires production or mock draft mode");
        };
    }
}
