/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

/**
    Binds a NodeDef to code for one target. The file and function are opaque here;
    they mean something only to the code generator for that target.
    A NodeGraph with its nodedef attribute set plays the same role structurally.
**/
public class Implementation extends InterfaceElement
{
    public static final String CATEGORY           = "implementation";
    public static final String NODE_DEF_ATTRIBUTE = "nodedef";
    public static final String FILE_ATTRIBUTE     = "file";
    public static final String FUNCTION_ATTRIBUTE = "function";

    public Implementation (String name)
    {
        super (CATEGORY, name);
    }

    public Element newInstance (String name)
    {
        return new Implementation (name);
    }

    public String getNodeDefString ()
    {
        return getAttribute (NODE_DEF_ATTRIBUTE);
    }

    public void setNodeDefString (String nodeDef)
    {
        setAttribute (NODE_DEF_ATTRIBUTE, nodeDef);
    }

    public String getFile ()
    {
        return getAttribute (FILE_ATTRIBUTE);
    }

    public void setFile (String file)
    {
        setAttribute (FILE_ATTRIBUTE, file);
    }

    public String getFunction ()
    {
        return getAttribute (FUNCTION_ATTRIBUTE);
    }

    public void setFunction (String function)
    {
        setAttribute (FUNCTION_ATTRIBUTE, function);
    }

    public boolean validate (StringBuilder message)
    {
        boolean result = validateRequire (! getNodeDefString ().isEmpty (), message, "Missing nodedef");
        return super.validate (message)  &&  result;
    }
}
