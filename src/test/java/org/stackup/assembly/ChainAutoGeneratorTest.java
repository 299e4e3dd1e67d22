package org.stackup.assembly;

import org.junit.jupiter.api.Test;
import org.stackup.geometry.Vec3;
import org.stackup.tolerance.ChainLink;
import org.stackup.tolerance.ContributionDirection;
import org.stackup.tolerance.LinkType;
import org.stackup.tolerance.ToleranceChain;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.stackup.assembly.AssemblyFixtures.block;
import static org.stackup.assembly.AssemblyFixtures.faceToFace;

class ChainAutoGeneratorTest {

    private static AssemblyGraph graph() {
        AssemblyPart noBox = new AssemblyPart("c", "C", 0, null, null, List.of(), null);
        return AssemblyGraphBuilder.build(
                List.of(block("a", new Vec3(10, 20, 5)), block("b", new Vec3(30, 1, 1)), noBox, block("d", new Vec3(1, 1, 1))),
                List.of(faceToFace("i-ab", "a", "b", 0.2), faceToFace("i-bc", "b", "c", 0))
        );
    }

    @Test
    void fromPath_alternatesPartsAndGaps() {
        ToleranceChain chain = ChainAutoGenerator.fromPath(graph(), "chain-1", "A → C", "a", "c");

        assertThat(chain).isNotNull();
        assertThat(chain.isCalculated()).isFalse();
        assertThat(chain.links()).extracting(ChainLink::id)
                .containsExactly("link-part-0", "link-iface-0", "link-part-1", "link-iface-1", "link-part-2");
        assertThat(chain.links()).extracting(ChainLink::type)
                .containsExactly(LinkType.PART_DIMENSION, LinkType.INTERFACE_GAP, LinkType.PART_DIMENSION,
                        LinkType.INTERFACE_GAP, LinkType.PART_DIMENSION);

        ChainLink first = chain.links().get(0);
        assertThat(first.name()).isEqualTo("A 长度");
        assertThat(first.nominal()).isEqualTo(20.0);
        assertThat(first.plusTolerance()).isCloseTo(0.02, within(1e-12));
        assertThat(first.direction()).isEqualTo(ContributionDirection.POSITIVE);
        assertThat(first.partId()).isEqualTo("a");

        ChainLink gap = chain.links().get(1);
        assertThat(gap.nominal()).isEqualTo(0.2);
        assertThat(gap.plusTolerance()).isEqualTo(0.05);
        assertThat(gap.interfaceId()).isEqualTo("i-ab");
        assertThat(gap.faceId()).isEqualTo("a-face-1");

        assertThat(chain.links().get(2).direction()).isEqualTo(ContributionDirection.NEGATIVE);
        assertThat(chain.links().get(3).nominal()).isEqualTo(0.05);
        assertThat(chain.links().get(4).nominal()).isEqualTo(50.0);

        assertThat(chain.startDatum().partId()).isEqualTo("a");
        assertThat(chain.startDatum().description()).isEqualTo("起始基准：A");
        assertThat(chain.endDatum().partId()).isEqualTo("c");
        assertThat(chain.endDatum().faceId()).isEqualTo("c-face-2");
    }

    @Test
    void fromPath_disconnectedIsNull() {
        assertThat(ChainAutoGenerator.fromPath(graph(), "chain-1", "x", "a", "d")).isNull();
    }

    @Test
    void overview_coversEveryPartThenInterfaces() {
        ToleranceChain chain = ChainAutoGenerator.overview(graph(), "chain-2", "装配概览");

        assertThat(chain.links()).hasSize(6);
        assertThat(chain.links().subList(0, 4)).allMatch(l -> l.type() == LinkType.PART_DIMENSION);
        assertThat(chain.links().subList(4, 6)).extracting(ChainLink::interfaceId).containsExactly("i-ab", "i-bc");
        assertThat(chain.startDatum()).isNull();
    }
}
