package nl.bytesoflife.deltaboard.agent;

import nl.bytesoflife.deltaboard.config.BoardSettings;
import nl.bytesoflife.deltaboard.document.BoardDocument;
import nl.bytesoflife.deltaboard.document.ObjectMap;
import nl.bytesoflife.deltaboard.document.TransactionOrigin;
import nl.bytesoflife.deltaboard.model.BoardObject;
import nl.bytesoflife.deltaboard.model.Bounds;
import nl.bytesoflife.deltaboard.model.FramePayload;
import nl.bytesoflife.deltaboard.model.Point;
import nl.bytesoflife.deltaboard.store.ContainmentSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic cleanup of frames an agent session created, run right before the diff is committed.
 * <p>
 * Two passes, in this order:
 * <ol>
 *   <li>Category relayout: a complete set of category frames (SWOT, retrospective) whose rectangles
 *       overlap is placed on a fixed grid around the centroid of their previous centers.</li>
 *   <li>Template wrap: when at least {@value #WRAP_THRESHOLD} new frames carry a real title, the
 *       largest one without a category title becomes the outer frame and is refitted around the
 *       others.</li>
 * </ol>
 * Frames that existed before the session are never touched.
 */
public class FrameLayoutNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FrameLayoutNormalizer.class);

    public static final int WRAP_THRESHOLD = 4;
    public static final double CATEGORY_GAP = 24;

    public static final List<CategorySet> CATEGORY_SETS = List.of(
            new CategorySet("swot", List.of("Strengths", "Weaknesses", "Opportunities", "Threats"), 2),
            new CategorySet("retrospective", List.of("Start", "Stop", "Continue"), 3));

    /**
     * Titles that belong together, in grid order.
     */
    public record CategorySet(String name, List<String> titles, int columns) {
        public CategorySet {
            titles = List.copyOf(titles);
            if (columns < 1) throw new IllegalArgumentException("Category set needs at least one column");
        }

        boolean matches(String title) {
            String key = normalizeTitle(title);
            for (String t : titles) {
                if (normalizeTitle(t).equals(key)) return true;
            }
            return false;
        }
    }

    /**
     * New bounds for one frame. When {@code carryContents} is set the frame's contents move along.
     */
    public record Adjustment(String frameId, Bounds target, boolean carryContents) {
    }

    private final BoardSettings settings;

    public FrameLayoutNormalizer(BoardSettings settings) {
        this.settings = settings;
    }

    /**
     * Computes the adjustments for the given new frames without writing anything.
     */
    public List<Adjustment> plan(List<BoardObject> newFrames) {
        Map<String, Bounds> current = new LinkedHashMap<>();
        for (BoardObject frame : newFrames) {
            current.put(frame.getId(), new Bounds(frame.getX(), frame.getY(), frame.getWidth(), frame.getHeight()));
        }
        List<Adjustment> adjustments = new ArrayList<>();

        for (CategorySet set : CATEGORY_SETS) {
            List<BoardObject> members = matchCategory(set, newFrames);
            if (members == null || !anyOverlap(members, current)) continue;

            double cx = 0;
            double cy = 0;
            for (BoardObject member : members) {
                Point c = current.get(member.getId()).center();
                cx += c.x();
                cy += c.y();
            }
            cx /= members.size();
            cy /= members.size();

            Point extent = GridArranger.extent(members, set.columns(), CATEGORY_GAP, CATEGORY_GAP);
            Point origin = new Point(cx - extent.x() / 2, cy - extent.y() / 2);
            Map<String, Point> targets = GridArranger.layout(members, set.columns(), CATEGORY_GAP, CATEGORY_GAP, origin);
            for (BoardObject member : members) {
                Point p = targets.get(member.getId());
                Bounds target = new Bounds(p.x(), p.y(), member.getWidth(), member.getHeight());
                current.put(member.getId(), target);
                adjustments.add(new Adjustment(member.getId(), target, true));
            }
            log.debug("Relaid {} overlapping '{}' frames", members.size(), set.name());
        }

        List<BoardObject> titled = new ArrayList<>();
        for (BoardObject frame : newFrames) {
            if (hasRealTitle(frame)) titled.add(frame);
        }
        if (titled.size() < WRAP_THRESHOLD) return adjustments;

        BoardObject outer = largest(titled, current);
        if (outer == null) return adjustments;

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (BoardObject frame : titled) {
            if (frame == outer) continue;
            Bounds b = current.get(frame.getId());
            minX = Math.min(minX, b.x());
            minY = Math.min(minY, b.y());
            maxX = Math.max(maxX, b.right());
            maxY = Math.max(maxY, b.bottom());
        }
        double margin = settings.layoutMargin();
        Bounds wrap = Bounds.fromEdges(minX - margin, minY - (settings.layoutTitleBar() + margin),
                maxX + margin, maxY + margin);
        adjustments.add(new Adjustment(outer.getId(), wrap, false));
        log.debug("Wrapping {} frames in '{}'", titled.size() - 1, outer.frame().title());
        return adjustments;
    }

    /**
     * Plans and writes the adjustments into {@code document} in one transaction, then re-syncs
     * containment for every frame that changed.
     *
     * @return ids of the adjusted frames
     */
    public Set<String> apply(BoardDocument document, ContainmentSynchronizer containment, List<String> newFrameIds) {
        ObjectMap objects = document.objects();
        List<BoardObject> frames = new ArrayList<>();
        for (String id : newFrameIds) {
            BoardObject obj = objects.get(id);
            if (obj != null && obj.isFrame()) frames.add(obj);
        }
        List<Adjustment> plan = plan(frames);
        Set<String> adjusted = new LinkedHashSet<>();
        if (plan.isEmpty()) return adjusted;
        for (Adjustment adjustment : plan) {
            adjusted.add(adjustment.frameId());
        }

        document.transact(TransactionOrigin.AGENT, () -> {
            Set<String> written = new LinkedHashSet<>();
            // contents are collected up front so a frame moved earlier cannot drag another one along
            Map<String, Set<String>> contents = new LinkedHashMap<>();
            for (Adjustment adjustment : plan) {
                if (adjustment.carryContents()) {
                    contents.put(adjustment.frameId(), contents(objects, adjustment.frameId(), adjusted));
                }
            }
            for (Adjustment adjustment : plan) {
                BoardObject frame = objects.get(adjustment.frameId());
                Bounds target = adjustment.target();
                if (adjustment.carryContents()) {
                    double dx = target.x() - frame.getX();
                    double dy = target.y() - frame.getY();
                    for (String id : contents.get(frame.getId())) {
                        BoardObject member = objects.get(id);
                        if (member == null) continue;
                        objects.set(member.translate(dx, dy));
                        written.add(id);
                    }
                }
                objects.set(frame.withBounds(target.x(), target.y(), target.width(), target.height()));
                written.add(frame.getId());
            }
            containment.syncAll(written);
        });
        return adjusted;
    }

    /**
     * Descendants of {@code frameId}, not descending into other adjusted frames.
     */
    private static Set<String> contents(ObjectMap objects, String frameId, Set<String> adjusted) {
        Set<String> out = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(frameId);
        seen.add(frameId);
        while (!worklist.isEmpty()) {
            BoardObject frame = objects.get(worklist.poll());
            if (frame == null || !frame.isFrame()) continue;
            for (String childId : frame.frame().children()) {
                if (adjusted.contains(childId) || !seen.add(childId)) continue;
                out.add(childId);
                worklist.add(childId);
            }
        }
        return out;
    }

    /**
     * One new frame per title of the set, in set order, or null when the set is incomplete.
     */
    private static List<BoardObject> matchCategory(CategorySet set, List<BoardObject> frames) {
        List<BoardObject> members = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (String title : set.titles()) {
            BoardObject match = null;
            for (BoardObject frame : frames) {
                if (!used.contains(frame.getId())
                        && normalizeTitle(frame.frame().title()).equals(normalizeTitle(title))) {
                    match = frame;
                    break;
                }
            }
            if (match == null) return null;
            used.add(match.getId());
            members.add(match);
        }
        return members;
    }

    private static boolean anyOverlap(List<BoardObject> members, Map<String, Bounds> current) {
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                if (current.get(members.get(i).getId()).overlaps(current.get(members.get(j).getId()))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Largest frame whose title is not a category title. Category frames never wrap their siblings.
     */
    private static BoardObject largest(List<BoardObject> frames, Map<String, Bounds> current) {
        BoardObject best = null;
        double bestArea = -1;
        for (BoardObject frame : frames) {
            if (isCategoryTitle(frame.frame().title())) continue;
            double area = current.get(frame.getId()).area();
            if (area > bestArea) {
                best = frame;
                bestArea = area;
            }
        }
        return best;
    }

    static boolean isCategoryTitle(String title) {
        for (CategorySet set : CATEGORY_SETS) {
            if (set.matches(title)) return true;
        }
        return false;
    }

    private static boolean hasRealTitle(BoardObject frame) {
        String title = frame.frame().title();
        return title != null && !title.isBlank() && !title.trim().equals(FramePayload.DEFAULT_TITLE);
    }

    private static String normalizeTitle(String title) {
        return title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
    }
}
