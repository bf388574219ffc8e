package dev.sfc.engine;

import dev.sfc.engine.Adjacency.Direction;
import dev.sfc.xml.TestXml;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class RelationResolverTest {

    @Test
    void linearChainLinksImmediateNeighboursOnly() {
        var chart = chart("""
            <SFCContent>
              <Step ID="0" Operand="Step_000" InitialStep="true"/>
              <Step ID="2" Operand="Step_001"/>
              <Transition ID="39" Operand="Tran_000"/>
              <Transition ID="40" Operand="Tran_001"/>
              <DirectedLink FromID="0" ToID="39"/>
              <DirectedLink FromID="39" ToID="2"/>
              <DirectedLink FromID="2" ToID="40"/>
            </SFCContent>
            """);

        var step0 = chart.step("0").orElseThrow();
        var step2 = chart.step("2").orElseThrow();
        var tran39 = chart.transition("39").orElseThrow();

        assertThat(step0.outgoing()).containsExactly("39");
        assertThat(step0.incoming()).isEmpty();
        assertThat(tran39.fromSteps()).containsExactly("0");
        assertThat(tran39.toSteps()).containsExactly("2");
        assertThat(step2.incoming()).containsExactly("39");
        assertThat(step2.outgoing()).containsExactly("40");
        assertThat(chart.transition("40").orElseThrow().toSteps()).isEmpty();
    }

    @Test
    void stepFansOutThroughDivergingBranch() {
        var chart = chart("""
            <SFCContent>
              <Step ID="0" Operand="Step_000"/>
              <Transition ID="47" Operand="Tran_005"/>
              <Transition ID="48" Operand="Tran_006"/>
              <Branch ID="61" BranchFlow="Diverge"><Leg ID="62"/><Leg ID="63"/></Branch>
              <DirectedLink FromID="0" ToID="61"/>
              <DirectedLink FromID="63" ToID="48"/>
              <DirectedLink FromID="62" ToID="47"/>
            </SFCContent>
            """);

        assertThat(chart.step("0").orElseThrow().outgoing()).containsExactly("47", "48");
        assertThat(chart.transition("47").orElseThrow().fromSteps()).containsExactly("0");
        assertThat(chart.transition("48").orElseThrow().fromSteps()).containsExactly("0");
    }

    @Test
    void transitionNeverReachesTransitionsBehindABranch() {
        var xml = TestXml.parse("""
            <SFCContent>
              <Transition ID="39" Operand="Tran_000"/>
              <Transition ID="47" Operand="Tran_005"/>
              <Transition ID="48" Operand="Tran_006"/>
              <Branch ID="61" BranchFlow="Diverge"><Leg ID="62"/><Leg ID="63"/></Branch>
              <DirectedLink FromID="39" ToID="61"/>
              <DirectedLink FromID="62" ToID="47"/>
              <DirectedLink FromID="63" ToID="48"/>
            </SFCContent>
            """);
        var registry = NodeRegistry.register(xml);
        var adjacency = EdgeCollector.collect(registry);
        var resolver = new RelationResolver(registry, adjacency);

        // The walk does pass through the branch and both legs.
        assertThat(adjacency.successors("61")).containsExactly("62", "63");
        assertThat(resolver.neighbours("39", Direction.FORWARD)).isEmpty();
        assertThat(resolver.neighbours("47", Direction.REVERSE)).isEmpty();
        assertThat(resolver.neighbours("61", Direction.FORWARD)).isEmpty();

        resolver.resolve();
        assertThat(registry.transitions().get("39").toSteps()).isEmpty();
        assertThat(registry.transitions().get("47").fromSteps()).doesNotContain("39");
        assertThat(registry.transitions().get("48").fromSteps()).doesNotContain("39");
    }

    @Test
    void stepToStepLinkIsNeitherReportedNorCrossed() {
        var chart = chart("""
            <SFCContent>
              <Step ID="1" Operand="Step_001"/>
              <Step ID="2" Operand="Step_002"/>
              <Transition ID="3" Operand="Tran_003"/>
              <DirectedLink FromID="1" ToID="2"/>
              <DirectedLink FromID="2" ToID="3"/>
            </SFCContent>
            """);

        assertThat(chart.step("1").orElseThrow().outgoing()).isEmpty();
        assertThat(chart.step("2").orElseThrow().outgoing()).containsExactly("3");
        assertThat(chart.transition("3").orElseThrow().fromSteps()).containsExactly("2");
    }

    @Test
    void searchStopsAtFirstTransition() {
        var chart = chart("""
            <SFCContent>
              <Step ID="0" Operand="Step_000"/>
              <Step ID="4" Operand="Step_002"/>
              <Transition ID="10" Operand="Tran_000"/>
              <Transition ID="11" Operand="Tran_001"/>
              <DirectedLink FromID="0" ToID="10"/>
              <DirectedLink FromID="10" ToID="11"/>
              <DirectedLink FromID="11" ToID="4"/>
            </SFCContent>
            """);

        assertThat(chart.step("0").orElseThrow().outgoing()).containsExactly("10");
        assertThat(chart.transition("10").orElseThrow().toSteps()).isEmpty();
        assertThat(chart.transition("11").orElseThrow().fromSteps()).isEmpty();
        assertThat(chart.step("4").orElseThrow().incoming()).containsExactly("11");
    }

    @Test
    void cyclesThroughBranchesTerminate() {
        var chart = chart("""
            <SFCContent>
              <Step ID="0" Operand="Step_000"/>
              <Transition ID="9" Operand="Tran_000"/>
              <Branch ID="20" BranchFlow="Diverge"><Leg ID="21"/></Branch>
              <Branch ID="30" BranchFlow="Diverge"><Leg ID="31"/></Branch>
              <DirectedLink FromID="0" ToID="20"/>
              <DirectedLink FromID="21" ToID="30"/>
              <DirectedLink FromID="31" ToID="20"/>
              <DirectedLink FromID="31" ToID="9"/>
            </SFCContent>
            """);

        assertThat(chart.step("0").orElseThrow().outgoing()).containsExactly("9");
    }

    @Test
    void relationListsAreSortedNumerically() {
        var chart = chart("""
            <SFCContent>
              <Step ID="100" Operand="Step_000"/>
              <Step ID="9" Operand="Step_001"/>
              <Step ID="20" Operand="Step_002"/>
              <Transition ID="5" Operand="Tran_000"/>
              <Branch ID="61" BranchFlow="Diverge"><Leg ID="62"/><Leg ID="63"/><Leg ID="64"/></Branch>
              <DirectedLink FromID="5" ToID="61"/>
              <DirectedLink FromID="62" ToID="100"/>
              <DirectedLink FromID="63" ToID="20"/>
              <DirectedLink FromID="64" ToID="9"/>
            </SFCContent>
            """);

        assertThat(chart.transition("5").orElseThrow().toSteps()).containsExactly("9", "20", "100");
    }

    @Test
    void nonNumericIdsSortAfterNumericOnes() {
        assertThat(Stream.of("b", "10", "a", "2")
            .sorted(NodeIds.NUMERIC_ORDER)
            .toList())
            .containsExactly("2", "10", "a", "b");
    }

    @Test
    void equalNumericValuesAreStillDistinct() {
        assertThat(NodeIds.NUMERIC_ORDER.compare("7", "07")).isNotZero();
        assertThat(Stream.of("7", "07", "6")
            .sorted(NodeIds.NUMERIC_ORDER)
            .toList())
            .containsExactly("6", "07", "7");

        var ids = new TreeSet<>(NodeIds.NUMERIC_ORDER);
        ids.addAll(List.of("7", "07"));
        assertThat(ids).containsExactly("07", "7");
    }

    private static SfcChart chart(String xml) {
        return SfcChart.from(TestXml.parse(xml));
    }
}
