/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

/**
    Declares the signature of a node: the category it applies to, its output type,
    and typed declarations of its ports. Values on the declarations serve as defaults.
**/
public class NodeDef extends InterfaceElement
{
    public static final String CATEGORY       = "nodedef";
    public static final String NODE_ATTRIBUTE = "node";

    public NodeDef (String name)
    {
        super (CATEGORY, name);
    }

    public Element newInstance (String name)
    {
        return new NodeDef (name);
    }

    /**
        @return The node category this definition applies to.
    **/
    public String getNodeString ()
    {
        return getAttribute (NODE_ATTRIBUTE);
    }

    public void setNodeString (String node)
    {
        setAttribute (NODE_ATTRIBUTE, node);
    }

    public boolean validate (StringBuilder message)
    {
        boolean result = validateRequire (! getNodeString ().isEmpty (), message, "Missing node category");
        result =         validateRequire (hasType (),                     message, "Missing type")  &&  result;
        return super.validate (message)  &&  result;
    }
}
