/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

/**
    A value slot that may also be connected to a node.
    The connection is stored only as the node's name. It is resolved every time it is asked for,
    so renaming or removing the upstream node silently leaves this port dangling.
**/
public abstract class PortElement extends ValueElement
{
    public static final String NODE_NAME_ATTRIBUTE = "nodename";

    public PortElement (String category, String name)
    {
        super (category, name);
    }

    /**
        The element whose children are searched first when resolving the connection name.
        If the name is not found there, each ancestor of the scope is searched in turn.
    **/
    public abstract Element getConnectionScope ();

    /**
        Keeps the owning document's connection index current whenever the node name changes,
        no matter which setter was used.
    **/
    public void setAttribute (String key, String value)
    {
        if (! key.equals (NODE_NAME_ATTRIBUTE))
        {
            super.setAttribute (key, value);
            return;
        }
        Document document = Document.of (this);
        if (document != null) document.unindexPort (this);
        super.setAttribute (key, value);
        if (document != null) document.indexPort (this);
    }

    public String getNodeName ()
    {
        return getAttribute (NODE_NAME_ATTRIBUTE);
    }

    /**
        @param nodeName Null or empty disconnects this port.
    **/
    public void setNodeName (String nodeName)
    {
        if (nodeName == null  ||  nodeName.isEmpty ()) removeAttribute (NODE_NAME_ATTRIBUTE);
        else                                           setAttribute (NODE_NAME_ATTRIBUTE, nodeName);
    }

    public boolean hasNodeName ()
    {
        return ! getNodeName ().isEmpty ();
    }

    /**
        Records the given node's name as our connection. Null disconnects.
        The type of this port is not changed.
    **/
    public void setConnectedNode (Node node)
    {
        if (node == null) setNodeName (null);
        else              setNodeName (node.getName ());
    }

    /**
        Resolves the stored node name, starting in our connection scope and walking up to the root.
        @return The connected node, or null if unconnected or the name doesn't resolve to a node.
    **/
    public Node getConnectedNode ()
    {
        String nodeName = getNodeName ();
        if (nodeName.isEmpty ()) return null;
        for (Element scope = getConnectionScope (); scope != null; scope = scope.getParent ())
        {
            Node node = scope.getChildOfType (Node.class, nodeName);
            if (node != null) return node;
        }
        return null;
    }

    /**
        @return true if a connection name is stored but does not resolve.
    **/
    public boolean isDangling ()
    {
        return hasNodeName ()  &&  getConnectedNode () == null;
    }
}
