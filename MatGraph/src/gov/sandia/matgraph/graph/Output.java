/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Edge;
import gov.sandia.matgraph.db.Element;

/**
    When owned by a graph, an output is a boundary port that publishes one of the graph's
    internal nodes. It is then a child of the graph in its own right, and takes part in
    topological ordering alongside the nodes.
**/
public class Output extends PortElement
{
    public static final String CATEGORY = "output";

    public Output (String name)
    {
        super (CATEGORY, name);
    }

    public Element newInstance (String name)
    {
        return new Output (name);
    }

    public Element getConnectionScope ()
    {
        if (parent == null) return null;
        if (parent instanceof NodeGraph) return parent;  // boundary output looks inward
        return parent.getParent ();
    }

    public int getUpstreamEdgeCount ()
    {
        return 1;
    }

    public Edge getUpstreamEdge (int index)
    {
        if (index != 0) return null;
        Node upstream = getConnectedNode ();
        if (upstream == null) return null;
        return new Edge (this, this, upstream);
    }
}
