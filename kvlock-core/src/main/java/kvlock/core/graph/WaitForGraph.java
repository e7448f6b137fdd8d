/*
 * Copyright 2021 Andre Gebers
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package kvlock.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directed graph used to find deadlocks. All methods synchronize on the graph itself, independent of
 * any lock that the vertices describe.
 * <p>
 * A vertex only exists while it has at least one incoming or outgoing edge.
 */
public class WaitForGraph<V> {

  private static final Logger log = LoggerFactory.getLogger(WaitForGraph.class);

  private final Graph<V, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);

  private static class Frame<V> {

    private final V vertex;

    private final Iterator<V> successors;

    private Frame(V vertex, Iterator<V> successors) {
      this.vertex = vertex;
      this.successors = successors;
    }

  }

  public synchronized void addEdge(V from, V to) {
    graph.addVertex(from);
    graph.addVertex(to);
    // no-op if the edge already exists
    graph.addEdge(from, to);
    log.trace("add edge '{}' -> '{}'", from, to);
  }

  public synchronized boolean removeEdge(V from, V to) {
    if(!graph.containsVertex(from) || !graph.containsVertex(to)) {
      return false;
    }
    boolean removed = graph.removeEdge(from, to) != null;
    dropIfUnconnected(from);
    dropIfUnconnected(to);
    log.trace("remove edge '{}' -> '{}', removed '{}'", from, to, removed);
    return removed;
  }

  /**
   * Remove the vertex and all edges touching it. Neighbours left without edges are dropped too.
   */
  public synchronized boolean removeVertex(V v) {
    if(!graph.containsVertex(v)) {
      return false;
    }
    Set<V> neighbours = new HashSet<>(Graphs.neighborSetOf(graph, v));
    graph.removeVertex(v);
    neighbours.forEach(this::dropIfUnconnected);
    return true;
  }

  /**
   * Remove all outgoing edges of the vertex.
   */
  public synchronized void removeOutgoingEdges(V v) {
    if(!graph.containsVertex(v)) {
      return;
    }
    List<V> successors = Graphs.successorListOf(graph, v);
    successors.forEach(s -> {
      graph.removeEdge(v, s);
      dropIfUnconnected(s);
    });
    dropIfUnconnected(v);
  }

  private void dropIfUnconnected(V v) {
    if(graph.containsVertex(v) && (graph.degreeOf(v) == 0)) {
      graph.removeVertex(v);
    }
  }

  public synchronized boolean containsEdge(V from, V to) {
    return graph.containsEdge(from, to);
  }

  public synchronized boolean containsVertex(V v) {
    return graph.containsVertex(v);
  }

  public synchronized Set<V> successorsOf(V v) {
    if(!graph.containsVertex(v)) {
      return Set.of();
    }
    return new LinkedHashSet<>(Graphs.successorListOf(graph, v));
  }

  public synchronized int vertexCount() {
    return graph.vertexSet().size();
  }

  public synchronized int edgeCount() {
    return graph.edgeSet().size();
  }

  public synchronized boolean hasCycle() {
    return cycleNodes() != null;
  }

  /**
   * Depth first search over the whole graph, iterative with an explicit stack.
   * @return the vertices of the first cycle found in path order starting at the target of the back edge,
   *         or {@code null} if the graph is acyclic
   */
  public synchronized List<V> cycleNodes() {
    Set<V> visited = new HashSet<>();
    Set<V> onStack = new HashSet<>();
    Deque<Frame<V>> stack = new ArrayDeque<>();
    for(V root : graph.vertexSet()) {
      if(!visited.add(root)) {
        continue;
      }
      push(stack, onStack, root);
      while(!stack.isEmpty()) {
        Frame<V> top = stack.peek();
        if(top.successors.hasNext()) {
          V next = top.successors.next();
          if(onStack.contains(next)) {
            return unwind(stack, next);
          } else if(visited.add(next)) {
            push(stack, onStack, next);
          }
        } else {
          stack.pop();
          onStack.remove(top.vertex);
        }
      }
    }
    return null;
  }

  private void push(Deque<Frame<V>> stack, Set<V> onStack, V v) {
    stack.push(new Frame<>(v, Graphs.successorListOf(graph, v).iterator()));
    onStack.add(v);
  }

  private List<V> unwind(Deque<Frame<V>> stack, V backEdgeTarget) {
    List<V> cycle = new ArrayList<>();
    boolean inCycle = false;
    // bottom of the stack first
    Iterator<Frame<V>> it = stack.descendingIterator();
    while(it.hasNext()) {
      V v = it.next().vertex;
      if(v.equals(backEdgeTarget)) {
        inCycle = true;
      }
      if(inCycle) {
        cycle.add(v);
      }
    }
    log.debug("cycle detected '{}'", cycle);
    return cycle;
  }

  @Override
  public synchronized String toString() {
    return graph.toString();
  }

}
