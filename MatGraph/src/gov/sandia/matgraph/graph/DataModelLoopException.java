/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.DataModelException;
import gov.sandia.matgraph.db.Element;

import java.util.List;

/**
    The children of a graph do not form a DAG, so no evaluation order exists.
**/
@SuppressWarnings("serial")
public class DataModelLoopException extends DataModelException
{
    protected String        graphName;
    protected List<Element> unvisited;  // Children that never reached in-degree zero. Every cycle lies among these.

    public DataModelLoopException (NodeGraph graph, List<Element> unvisited)
    {
        super (graph, "Encountered a cycle in graph: " + graph.getName ());
        graphName      = graph.getName ();
        this.unvisited = unvisited;
    }

    public String getGraphName ()
    {
        return graphName;
    }

    public List<Element> getUnvisited ()
    {
        return unvisited;
    }
}
