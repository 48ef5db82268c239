/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

public class Input extends PortElement
{
    public static final String CATEGORY = "input";

    public Input (String name)
    {
        super (CATEGORY, name);
    }

    public Element newInstance (String name)
    {
        return new Input (name);
    }

    /**
        An input connects to a sibling of the element that owns it.
    **/
    public Element getConnectionScope ()
    {
        if (parent == null) return null;
        return parent.getParent ();
    }
}
