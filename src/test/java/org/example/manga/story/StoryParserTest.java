package org.example.manga.story;

import org.example.manga.model.EntityDefinition;
import org.example.manga.model.EntityKind;
import org.example.manga.model.PageRecord;
import org.example.manga.story.StoryParser.DialogueLine;
import org.example.manga.story.StoryParser.ParsedStory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoryParserTest {

    private StoryParser parser;

    @BeforeEach
    void setUp() {
        parser = new StoryParser();
    }

    @Test
    void parse_splitsGlobalContextAndPagesOnHeadings() {
        String story = """
            # The Rooftop

            A quiet school story.

            ## Page 1: Arrival
            Kenji climbs the stairs.

            ### Page 2
            Aiko waits by the fence.
            """;

        ParsedStory parsed = parser.parse(story);

        assertEquals("# The Rooftop\n\nA quiet school story.", parsed.globalContext());
        assertEquals(2, parsed.pages().size());
        assertEquals("Page 1: Arrival", parsed.pages().get(0).header());
        assertEquals("Kenji climbs the stairs.", parsed.pages().get(0).content());
        assertEquals("Page 2", parsed.pages().get(1).header());
        assertEquals("Aiko waits by the fence.", parsed.pages().get(1).content());
        assertEquals(1, parsed.pages().get(1).index());
    }

    @Test
    void parse_recognisesLabelStylePageMarkers() {
        String story = """
            Intro text.
            Page 1: The Gate
            Kenji arrives.
            Page 2: The Hall
            He runs inside.
            """;

        ParsedStory parsed = parser.parse(story);

        assertEquals("Intro text.", parsed.globalContext());
        assertEquals(List.of("Page 1: The Gate", "Page 2: The Hall"),
                parsed.pages().stream().map(PageRecord::header).toList());
        assertFalse(parsed.pages().get(0).content().contains("The Gate"));
    }

    @Test
    void parse_withoutPageMarkersReturnsSinglePage() {
        ParsedStory parsed = parser.parse("Kenji and Aiko share lunch on the roof.");

        assertEquals("", parsed.globalContext());
        assertEquals(1, parsed.pages().size());
        assertEquals(PageRecord.SINGLE_PAGE_HEADER, parsed.pages().get(0).header());
        assertEquals("Kenji and Aiko share lunch on the roof.", parsed.pages().get(0).content());
    }

    @Test
    void parse_renamesDuplicateHeaders() {
        ParsedStory parsed = parser.parse("## Page 1\nA\n## Page 1\nB\n");

        assertEquals("Page 1", parsed.pages().get(0).header());
        assertEquals("Page 1 (2)", parsed.pages().get(1).header());
    }

    @Test
    void extractEntities_readsBulletsUnderCharacterHeading() {
        String context = """
            # The Rooftop

            ## Characters
            - **Kenji:** A tall, serious boy with spiky black hair
            - **Aiko**: Cheerful girl with twin tails and a red scarf
            """;

        List<EntityDefinition> entities = parser.extractEntities(context);

        assertEquals(2, entities.size());
        assertEquals("Kenji", entities.get(0).name());
        assertEquals("A tall, serious boy with spiky black hair", entities.get(0).description());
        assertEquals(EntityKind.CHARACTER, entities.get(0).kind());
        assertFalse(entities.get(0).headingStyle());
        assertEquals("- **Kenji:** A tall, serious boy with spiky black hair", entities.get(0).sourceLine());
        assertEquals("Aiko", entities.get(1).name());
    }

    @Test
    void extractEntities_collectsNestedBulletsWhenInlineDescriptionIsShort() {
        String context = """
            ## Cast
            - **Kenji:**
              - **Visuals:** spiky red hair, school uniform
              - Quiet and serious
            - **Aiko:** Cheerful girl with twin tails
            """;

        List<EntityDefinition> entities = parser.extractEntities(context);

        assertEquals(2, entities.size());
        assertEquals("spiky red hair, school uniform Quiet and serious", entities.get(0).description());
        assertEquals("Cheerful girl with twin tails", entities.get(1).description());
    }

    @Test
    void extractEntities_supportsSubHeadingDefinitions() {
        String context = """
            ## Main Cast
            ### Haruto
            Tall boy with round glasses.
            ### Character Style
            Thick ink lines.
            """;

        List<EntityDefinition> entities = parser.extractEntities(context);

        assertEquals(1, entities.size());
        assertEquals("Haruto", entities.get(0).name());
        assertEquals("Tall boy with round glasses.", entities.get(0).description());
        assertTrue(entities.get(0).headingStyle());
    }

    @Test
    void extractEntities_classifiesEnvironmentSections() {
        String context = """
            ## Setting
            - **School Rooftop:** A windy rooftop at sunset with a chain-link fence

            **Characters:**
            - **Mika:** Short hair, freckles, red scarf
            """;

        List<EntityDefinition> entities = parser.extractEntities(context);

        assertEquals(2, entities.size());
        assertEquals("School Rooftop", entities.get(0).name());
        assertEquals(EntityKind.ENVIRONMENT, entities.get(0).kind());
        assertEquals("Mika", entities.get(1).name());
        assertEquals(EntityKind.CHARACTER, entities.get(1).kind());
    }

    @Test
    void extractEntities_ignoresUnvalidatedSectionsAndBanners() {
        String context = """
            ## Themes
            - **Friendship:** the central theme of the story

            ## Characters
            - **THE BIG REVEAL SCENE:** not a person
            - **Page 3:** not a person either
            """;

        List<EntityDefinition> entities = parser.extractEntities(context);

        assertTrue(entities.isEmpty());
    }

    @Test
    void extractEntities_treatsBoldVocabularyBulletAsSection() {
        String context = """
            - **ENVIRONMENT ANCHORS**:
              - **Old Shrine:** Moss-covered stone steps under cedar trees
            """;

        List<EntityDefinition> entities = parser.extractEntities(context);

        assertEquals(1, entities.size());
        assertEquals("Old Shrine", entities.get(0).name());
        assertEquals(EntityKind.ENVIRONMENT, entities.get(0).kind());
    }

    @Test
    void extractImagePaths_preservesOrderWithoutDuplicates() {
        List<String> paths = parser.extractImagePaths(
                "See ![Kenji](characters/kenji_portrait.png) and refs/aiko.JPG, again characters/kenji_portrait.png");

        assertEquals(List.of("characters/kenji_portrait.png", "refs/aiko.JPG"), paths);
    }

    @Test
    void extractDialogue_findsQuotedLines() {
        String script = """
            Kenji: "We made it."
            - **Aiko**: “Finally!”
            The wind blows.
            """;

        List<DialogueLine> lines = parser.extractDialogue(script);

        assertEquals(2, lines.size());
        assertEquals(new DialogueLine("Kenji", "We made it."), lines.get(0));
        assertEquals(new DialogueLine("Aiko", "Finally!"), lines.get(1));
    }
}
