package io.xfgslicer.classify;

import io.xfgslicer.model.NodeRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LineResolverTest {

    private static NodeRecord node(String key, String location) {
        return new NodeRecord("Identifier", "x", location, "", key);
    }

    @Test
    void resolve_usesOwnLocation() {
        List<NodeRecord> nodes = List.of(node("1", "10:5:120:130"));

        LineResolution resolution = LineResolver.resolve(nodes, 0);

        assertThat(resolution.isResolved()).isTrue();
        assertThat(resolution.line()).isEqualTo(10);
        assertThat(resolution.sourceIndex()).isZero();
    }

    @Test
    void resolve_walksBackToNearestLocatedNode() {
        List<NodeRecord> nodes = List.of(
                node("1", "3:0"),
                node("2", "7:2"),
                node("3", ""),
                node("4", ""));

        LineResolution resolution = LineResolver.resolve(nodes, 3);

        assertThat(resolution.line()).isEqualTo(7);
        assertThat(resolution.sourceIndex()).isEqualTo(1);
    }

    @Test
    void resolve_skipsMalformedLocationsOnTheWayBack() {
        List<NodeRecord> nodes = List.of(
                node("1", "4:1"),
                node("2", "abc:1"),
                node("3", ""));

        assertThat(LineResolver.resolve(nodes, 2).line()).isEqualTo(4);
    }

    @Test
    void resolve_failsWithNoLocationWhenNothingPrecedes() {
        List<NodeRecord> nodes = List.of(node("1", ""), node("2", ""));

        LineResolution resolution = LineResolver.resolve(nodes, 1);

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.reason()).isEqualTo(DropReason.NO_LOCATION);
        assertThat(resolution.line()).isEqualTo(-1);
    }

    @Test
    void resolve_reportsMalformedWhenOnlyBadLocationsSeen() {
        List<NodeRecord> nodes = List.of(node("1", "line?"), node("2", ""));

        assertThat(LineResolver.resolve(nodes, 1).reason()).isEqualTo(DropReason.MALFORMED_LOCATION);
    }

    @Test
    void resolve_doesNotLookForward() {
        List<NodeRecord> nodes = List.of(node("1", ""), node("2", "9:0"));

        assertThat(LineResolver.resolve(nodes, 0).isResolved()).isFalse();
    }

    @Test
    void resolve_isIdempotent() {
        List<NodeRecord> nodes = List.of(node("1", "12:0"), node("2", ""), node("3", "bad"), node("4", ""));

        for (int i = 0; i < nodes.size(); i++) {
            LineResolution first = LineResolver.resolve(nodes, i);
            for (int run = 0; run < 3; run++) {
                assertThat(LineResolver.resolve(nodes, i)).isEqualTo(first);
            }
        }
    }

    @Test
    void nodeIdToLine_mapsOnlyNodesWithOwnReadableLocation() {
        List<NodeRecord> nodes = List.of(
                node("1", "10:5"),
                node("2", ""),
                node("3", "oops"),
                node("4", "12:0"));

        Map<String, Integer> lines = LineResolver.nodeIdToLine(nodes);

        assertThat(lines).containsOnly(Map.entry("1", 10), Map.entry("4", 12));
    }

    @Test
    void resolve_stopsAtNonPositiveLineWithoutResolving() {
        List<NodeRecord> nodes = List.of(node("1", "6:1"), node("2", "0:0"), node("3", ""));

        LineResolution resolution = LineResolver.resolve(nodes, 2);

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.reason()).isEqualTo(DropReason.NO_LOCATION);
    }

    @Test
    void nodeIdToLine_keepsLineZero() {
        List<NodeRecord> nodes = List.of(node("1", "0:0"), node("2", "-3:1"), node("3", "5:2"));

        assertThat(LineResolver.nodeIdToLine(nodes))
                .containsOnly(Map.entry("1", 0), Map.entry("2", -3), Map.entry("3", 5));
    }

    @Test
    void parseLine_readsTextBeforeFirstColon() {
        assertThat(LineResolver.parseLine("15")).hasValue(15);
        assertThat(LineResolver.parseLine(" 8:3 ")).hasValue(8);
        assertThat(LineResolver.parseLine("0:1")).hasValue(0);
        assertThat(LineResolver.parseLine("x:1")).isEmpty();
        assertThat(LineResolver.parseLine("")).isEmpty();
        assertThat(LineResolver.parseLine(null)).isEmpty();
    }
}
