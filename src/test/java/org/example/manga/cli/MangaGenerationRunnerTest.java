package org.example.manga.cli;

import org.example.manga.model.Layout;
import org.example.manga.model.RunOptions;
import org.example.manga.model.RunResult;
import org.example.manga.service.GenerationPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MangaGenerationRunnerTest {

    @Mock
    private GenerationPipeline generationPipeline;

    private MangaGenerationRunner runner;

    @BeforeEach
    void setUp() {
        runner = new MangaGenerationRunner(generationPipeline);
        ReflectionTestUtils.setField(runner, "story", "");
        ReflectionTestUtils.setField(runner, "retryCount", 3);
        ReflectionTestUtils.setField(runner, "minScore", 8);
        ReflectionTestUtils.setField(runner, "minLikeness", 7);
        ReflectionTestUtils.setField(runner, "minContinuity", 7);
        ReflectionTestUtils.setField(runner, "minStory", 7);
        ReflectionTestUtils.setField(runner, "layout", "square");
        ReflectionTestUtils.setField(runner, "style", "shonen");
        ReflectionTestUtils.setField(runner, "scenePrompt", "");
        ReflectionTestUtils.setField(runner, "page", "");
        ReflectionTestUtils.setField(runner, "startPage", "");
    }

    @Test
    void run_passesStoryArgumentAndOptionsToPipeline() throws Exception {
        ReflectionTestUtils.setField(runner, "twoPhase", true);
        ReflectionTestUtils.setField(runner, "layout", "webtoon");
        ReflectionTestUtils.setField(runner, "page", "2");
        when(generationPipeline.run(eq(Path.of("story.md")), any()))
                .thenReturn(RunResult.success("Successfully generated 1 of 1 manga pages", List.of("/out/page_2_final.png")));

        runner.run("--spring.profiles.active=generate", "story.md");

        ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
        verify(generationPipeline).run(eq(Path.of("story.md")), options.capture());
        assertTrue(options.getValue().twoPhase());
        assertEquals(Layout.WEBTOON, options.getValue().layout());
        assertEquals("2", options.getValue().pageSelector());
        assertNull(options.getValue().startPage());
    }

    @Test
    void run_fallsBackToConfiguredStory() throws Exception {
        ReflectionTestUtils.setField(runner, "story", "configured.md");
        when(generationPipeline.run(eq(Path.of("configured.md")), any()))
                .thenReturn(RunResult.failure("Story file not found: configured.md"));

        runner.run();

        verify(generationPipeline).run(eq(Path.of("configured.md")), any());
    }

    @Test
    void run_withoutStoryDoesNothing() throws Exception {
        runner.run("--verbose");

        verifyNoInteractions(generationPipeline);
    }

    @Test
    void run_withInvalidOptionsDoesNotStartPipeline() throws Exception {
        ReflectionTestUtils.setField(runner, "retryCount", 0);

        runner.run("story.md");

        verifyNoInteractions(generationPipeline);
    }

    @Test
    void buildOptions_rejectsUnknownLayout() {
        ReflectionTestUtils.setField(runner, "layout", "panorama");

        assertThrows(IllegalArgumentException.class, () -> runner.buildOptions());
    }
}
