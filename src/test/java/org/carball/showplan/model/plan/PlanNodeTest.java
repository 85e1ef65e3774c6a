package org.carball.showplan.model.plan;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PlanNodeTest {

    @Test
    public void shouldLinkChildToParent() {
        PlanNode parent = node(0);
        PlanNode child = node(1);

        parent.addChild(child);

        assertThat(parent.getChildren()).containsExactly(child);
        assertThat(child.getParent()).isSameAs(parent);
        assertThat(parent.isLeaf()).isFalse();
        assertThat(child.isLeaf()).isTrue();
    }

    @Test
    public void shouldRefuseNodeAsItsOwnChild() {
        PlanNode node = node(0);

        assertThatThrownBy(() -> node.addChild(node))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRefuseChildThatAlreadyHasParent() {
        PlanNode first = node(0);
        PlanNode second = node(1);
        PlanNode shared = node(2);
        first.addChild(shared);

        assertThatThrownBy(() -> second.addChild(shared))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already attached");
        assertThat(second.getChildren()).isEmpty();
    }

    @Test
    public void shouldNotExposeMutableChildren() {
        PlanNode parent = node(0);
        parent.addChild(node(1));

        assertThatThrownBy(() -> parent.getChildren().add(node(2)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void shouldWalkTreeInPreOrder() {
        PlanNode root = node(0);
        PlanNode left = node(1);
        PlanNode leftLeaf = node(2);
        PlanNode right = node(3);
        root.addChild(left);
        left.addChild(leftLeaf);
        root.addChild(right);

        assertThat(root.descendantsAndSelf()).extracting(PlanNode::getNodeId).containsExactly(0, 1, 2, 3);
    }

    @Test
    public void shouldUseIdentityEquality() {
        PlanNode a = node(5);
        PlanNode b = node(5);

        assertThat(a).isNotEqualTo(b);
        assertThat(a.toString()).contains("nodeId=5");
    }

    private static PlanNode node(int nodeId) {
        PlanNode node = new PlanNode();
        node.setNodeId(nodeId);
        return node;
    }
}
