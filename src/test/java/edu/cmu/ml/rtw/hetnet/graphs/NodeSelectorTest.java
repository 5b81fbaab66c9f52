package edu.cmu.ml.rtw.hetnet.graphs;

import junit.framework.TestCase;

import com.google.common.collect.Lists;

import edu.cmu.ml.rtw.hetnet.errors.InvalidSelectorException;
import edu.cmu.ml.rtw.hetnet.util.TestUtil;
import edu.cmu.ml.rtw.hetnet.util.TestUtil.Function;

public class NodeSelectorTest extends TestCase {

  private HetGraph graph = ToyGraphs.abc();

  public void testTypeSelectorSelectsEveryNodeOfTheType() {
    SelectedNodes selected = NodeSelector.ofType("C").resolve(graph);
    assertEquals(Lists.newArrayList("c1", "c2"), selected.getIds());
    assertEquals(5, selected.getIndices()[0]);
    assertEquals("C", selected.getType());
    assertEquals("c_id", selected.getColumnName());
  }

  public void testIdSelectorKeepsGivenOrder() {
    SelectedNodes selected = NodeSelector.ofIds(Lists.newArrayList("b3", "b1")).resolve(graph);
    assertEquals(Lists.newArrayList("b3", "b1"), selected.getIds());
    assertEquals(4, selected.getIndices()[0]);
    assertEquals(2, selected.getIndices()[1]);
  }

  public void testIndexSelector() {
    SelectedNodes selected = NodeSelector.ofIndices(Lists.newArrayList(1, 0)).resolve(graph);
    assertEquals(Lists.newArrayList("a2", "a1"), selected.getIds());
    assertEquals(2, selected.size());
  }

  public void testParse() {
    assertEquals(Lists.newArrayList("a1", "b2"),
                 NodeSelector.parse("ids:a1, b2").resolve(graph).getIds());
    assertEquals(Lists.newArrayList("c2"),
                 NodeSelector.parse("indices:6").resolve(graph).getIds());
    assertEquals(3, NodeSelector.parse("B").resolve(graph).size());
    assertEquals("ids:a1,b2", NodeSelector.parse("ids:a1,b2").toString());
  }

  public void testInvalidSelectorsFail() {
    for (final NodeSelector selector : Lists.newArrayList(
        NodeSelector.ofType("D"),
        NodeSelector.ofIds(Lists.newArrayList("a1", "nope")),
        NodeSelector.ofIndices(Lists.newArrayList(7)),
        NodeSelector.ofIndices(Lists.newArrayList(-1)),
        NodeSelector.ofIds(Lists.<String>newArrayList()))) {
      TestUtil.expectError(InvalidSelectorException.class, new Function() {
        @Override
        public void call() {
          selector.resolve(graph);
        }
      });
    }
    TestUtil.expectError(InvalidSelectorException.class, new Function() {
      @Override
      public void call() {
        NodeSelector.parse("indices:1,x");
      }
    });
    TestUtil.expectError(InvalidSelectorException.class, new Function() {
      @Override
      public void call() {
        NodeSelector.parse(" ");
      }
    });
  }
}
