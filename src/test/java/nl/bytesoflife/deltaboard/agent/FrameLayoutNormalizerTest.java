package nl.bytesoflife.deltaboard.agent;

import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.FramePayload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameLayoutNormalizerTest {

    private final FrameLayoutNormalizer normalizer = new FrameLayoutNormalizer(BoardSettings.defaults());

    private static BoardObject frame(String id, String title, double x, double y, double w, double h) {
        return new BoardObject(id, x, y, w, h, 0, "ai:test", null, new FramePayload(title, null, List.of()));
    }

    @Test
    void overlappingSwotFramesAreRelaidOnGrid() {
        List<FrameLayoutNormalizer.Adjustment> plan = normalizer.plan(List.of(
                frame("t", "Threats", 100, 100, 300, 200),
                frame("s", "Strengths", 0, 0, 300, 200),
                frame("w", "weaknesses ", 100, 0, 300, 200),
                frame("o", "Opportunities", 0, 100, 300, 200)));

        assertEquals(List.of(
                new FrameLayoutNormalizer.Adjustment("s", new Bounds(-112, -62, 300, 200), true),
                new FrameLayoutNormalizer.Adjustment("w", new Bounds(212, -62, 300, 200), true),
                new FrameLayoutNormalizer.Adjustment("o", new Bounds(-112, 162, 300, 200), true),
                new FrameLayoutNormalizer.Adjustment("t", new Bounds(212, 162, 300, 200), true)), plan);
    }

    @Test
    void separatedCategoryFramesStayPut() {
        assertTrue(normalizer.plan(List.of(
                frame("a", "Start", 0, 0, 300, 200),
                frame("b", "Stop", 400, 0, 300, 200),
                frame("c", "Continue", 800, 0, 300, 200))).isEmpty());
    }

    @Test
    void incompleteCategorySetIsIgnored() {
        assertTrue(normalizer.plan(List.of(
                frame("a", "Start", 0, 0, 300, 200),
                frame("b", "Stop", 10, 10, 300, 200))).isEmpty());
    }

    @Test
    void largestTitledFrameWrapsTheOthers() {
        List<FrameLayoutNormalizer.Adjustment> plan = normalizer.plan(List.of(
                frame("outer", "Roadmap", 0, 0, 360, 240),
                frame("q1", "Q1", 100, 300, 200, 200),
                frame("q2", "Q2", 400, 300, 200, 200),
                frame("q3", "Q3", 700, 300, 200, 200)));

        assertEquals(List.of(new FrameLayoutNormalizer.Adjustment("outer", new Bounds(76, 244, 848, 280), false)), plan);
    }

    @Test
    void defaultTitlesDoNotCountTowardsWrap() {
        assertTrue(normalizer.plan(List.of(
                frame("outer", "Roadmap", 0, 0, 360, 240),
                frame("q1", "Q1", 100, 300, 200, 200),
                frame("q2", "Q2", 400, 300, 200, 200),
                frame("q3", "Frame", 700, 300, 200, 200),
                frame("q4", "  ", 1000, 300, 200, 200))).isEmpty());
    }

    @Test
    void categoryFramesNeverWrapTheirSiblings() {
        assertTrue(normalizer.plan(List.of(
                frame("s", "Strengths", 0, 0, 300, 200),
                frame("w", "Weaknesses", 400, 0, 300, 200),
                frame("o", "Opportunities", 0, 400, 300, 200),
                frame("t", "Threats", 400, 400, 300, 200))).isEmpty());
    }

    @Test
    void categoryTitlesMatchIgnoringCase() {
        assertTrue(FrameLayoutNormalizer.isCategoryTitle(" strengths"));
        assertTrue(FrameLayoutNormalizer.isCategoryTitle("CONTINUE"));
        assertFalse(FrameLayoutNormalizer.isCategoryTitle("SWOT Analysis"));
        assertFalse(FrameLayoutNormalizer.isCategoryTitle(null));
    }
}
