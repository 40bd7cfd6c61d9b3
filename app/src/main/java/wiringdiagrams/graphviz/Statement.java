package wiringdiagrams.graphviz;

/** Statement inside a graph or subgraph body. */
public interface Statement {}
