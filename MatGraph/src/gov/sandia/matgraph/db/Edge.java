/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.db;

/**
    A resolved dependency: downstream depends on upstream through the connecting element.
    Edges are never stored. They are rebuilt from connection names on every query,
    so holding one across a mutation of the tree may give a stale answer.
**/
public class Edge
{
    protected Element downstream;
    protected Element connecting;  // The port that carries the connection name. May be the downstream element itself.
    protected Element upstream;

    public Edge (Element downstream, Element connecting, Element upstream)
    {
        this.downstream = downstream;
        this.connecting = connecting;
        this.upstream   = upstream;
    }

    public Element getDownstreamElement ()
    {
        return downstream;
    }

    public Element getConnectingElement ()
    {
        return connecting;
    }

    public Element getUpstreamElement ()
    {
        return upstream;
    }

    @Override
    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof Edge)) return false;
        Edge that = (Edge) o;
        return downstream == that.downstream  &&  connecting == that.connecting  &&  upstream == that.upstream;
    }

    @Override
    public int hashCode ()
    {
        int result = System.identityHashCode (downstream);
        result = 31 * result + System.identityHashCode (connecting);
        result = 31 * result + System.identityHashCode (upstream);
        return result;
    }

    public String toString ()
    {
        return upstream.getNamePath () + " -> " + connecting.getNamePath ();
    }
}
