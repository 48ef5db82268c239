/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

/**
    A uniform value. Unlike an input, it can never be connected.
**/
public class Parameter extends ValueElement
{
    public static final String CATEGORY = "parameter";

    public Parameter (String name)
    {
        super (CATEGORY, name);
    }

    public Element newInstance (String name)
    {
        return new Parameter (name);
    }
}
