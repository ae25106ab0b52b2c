package ai.cv.composer.draft;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class DraftServiceTest {

    private final List<Duration> sleeps = new ArrayList<>();

    @Test
    void passThroughReturnsSourceUnchanged() {
        DraftService service = serviceWith(request -> "unused");

        assertThat(service.draft(DraftRequest.of("# Jane"), DraftMode.PASS_THROUGH)).isEqualTo("# Jane");
    }

    @Test
    void mockDraftListsSettingsAndSourceLines() {
        DraftService service = serviceWith(request -> "unused");
        DraftRequest request = new DraftRequest("Java developer\n\n  Bratislava ", Optional.of("Drives"), "europass", "English");

        String draft = service.draft(request, DraftMode.MOCK);

        assertThat(draft.lines()).containsExactly(
                "# [MOCK] CV draft",
                "## FORMAT",
                "- europass",
                "## LANGUAGE",
                "- English",
                "",
                "## SOURCE",
                "- Java developer",
                "- Bratislava",
                "",
                "## ADDITIONAL INFORMATION",
                "- Drives");
    }

    @Test
    void blankDraftFallsBackToSource() {
        DraftService service = serviceWith(request -> "  \n");

        assertThat(service.draft(DraftRequest.of("original"), DraftMode.PRODUCTION)).isEqualTo("original");
    }

    @Test
    void retriesRateLimitedCalls() {
        AtomicInteger calls = new AtomicInteger();
        DraftService service = serviceWith(request -> {
            if (calls.incrementAndGet() < 3) {
                throw new DraftGenerationException("rate limited", new RuntimeException("429 RESOURCE_EXHAUSTED"));
            }
            return "# Drafted";
        });

        assertThat(service.draft(DraftRequest.of("cv"), DraftMode.PRODUCTION)).isEqualTo("# Drafted");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    void honorsProviderRetryDelay() {
        AtomicInteger calls = new AtomicInteger();
        DraftService service = serviceWith(request -> {
            if (calls.incrementAndGet() == 1) {
                throw new DraftGenerationException("rate limited",
                        new RuntimeException("429 Too Many Requests, please retry in 1.5s"));
            }
            return "# Drafted";
        });

        service.draft(DraftRequest.of("cv"), DraftMode.PRODUCTION);

        assertThat(sleeps).containsExactly(Duration.ofMillis(1500));
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        DraftService service = serviceWith(request -> {
            calls.incrementAndGet();
            throw new DraftGenerationException("rate limited", new RuntimeException("RESOURCE_EXHAUSTED"));
        });

        assertThatThrownBy(() -> service.draft(DraftRequest.of("cv"), DraftMode.PRODUCTION))
                .isInstanceOf(DraftGenerationException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void doesNotRetryOtherFailures() {
        AtomicInteger calls = new AtomicInteger();
        DraftService service = serviceWith(request -> {
            calls.incrementAndGet();
            throw new DraftGenerationException("model missing", null);
        });

        assertThatThrownBy(() -> service.draft(DraftRequest.of("cv"), DraftMode.PRODUCTION))
                .hasMessage("model missing");
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void parsesDraftModeNames() {
        assertThat(DraftMode.from("pass-through")).isEqualTo(DraftMode.PASS_THROUGH);
        assertThat(DraftMode.from("Production")).isEqualTo(DraftMode.PRODUCTION);
        assertThat(DraftMode.from(null)).isEqualTo(DraftMode.PASS_THROUGH);
        assertThatThrownBy(() -> DraftMode.from("live")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reviewsWithMockAdvisor() {
        DraftService service = serviceWith(request -> "unused");

        String review = service.perform(CvAction.REVIEW, DraftRequest.of("Skills: Java\nEducation: MSc"), DraftMode.MOCK);

        assertThat(review).startsWith("[MOCK] CV review").contains("- Covers education", "- No projects section");
    }

    @Test
    void retriesRateLimitedFeedback() {
        AtomicInteger calls = new AtomicInteger();
        CvAdvisor advisor = new StubAdvisor(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new DraftGenerationException("rate limited", new RuntimeException("429"));
            }
            return "  Score: 8/10  ";
        });

        String review = serviceWith(request -> "unused", advisor).review(DraftRequest.of("cv"), DraftMode.PRODUCTION);

        assertThat(review).isEqualTo("Score: 8/10");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void blankFeedbackIsAnError() {
        CvAdvisor advisor = new StubAdvisor(() -> " \n ");

        assertThatThrownBy(() -> serviceWith(request -> "unused", advisor)
                .missingInformation(DraftRequest.of("cv"), DraftMode.PRODUCTION))
                .isInstanceOf(DraftGenerationException.class)
                .hasMessageContaining("missing information");
    }

    @Test
    void passThroughModeHasNoAdvisor() {
        DraftService service = serviceWith(request -> "unused");

        assertThatThrownBy(() -> service.review(DraftRequest.of("cv"), DraftMode.PASS_THROUGH))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesActionNames() {
        assertThat(CvAction.from("missing-info")).isEqualTo(CvAction.MISSING_INFO);
        assertThat(CvAction.from(" Review ")).isEqualTo(CvAction.REVIEW);
        assertThat(CvAction.from(null)).isEqualTo(CvAction.DRAFT);
        assertThatThrownBy(() -> CvAction.from("score")).isInstanceOf(IllegalArgumentException.class);
    }

    private DraftService serviceWith(DraftGenerator production) {
        return serviceWith(production, new MockCvAdvisor());
    }

    private DraftService serviceWith(DraftGenerator production, CvAdvisor productionAdvisor) {
        DraftGeneratorFactory factory = new DraftGeneratorFactory(production,
                new PassThroughDraftGenerator(), new MockDraftGenerator(), productionAdvisor, new MockCvAdvisor());
        return new DraftService(factory, 3, 1, 4, 0.0, sleeps::add);
    }

    private static final class StubAdvisor implements CvAdvisor {

        private final Supplier<String> answer;

        StubAdvisor(Supplier<String> answer) {
            this.answer = answer;
        }

        @Override
        public String review(DraftRequest request) {
            return answer.get();
        }

        @Override
        public String missingInformation(DraftRequest request) {
            return answer.get();
        }
    }
}
