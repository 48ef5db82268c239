/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

/**
    A typed value slot. Holds an optional literal value string, which is never parsed here,
    and an optional interface name. The interface name binds this slot to a boundary port of
    whatever node instantiates the enclosing graph. Flattening resolves and removes it.
**/
public abstract class ValueElement extends Element
{
    public static final String TYPE_ATTRIBUTE           = "type";
    public static final String VALUE_ATTRIBUTE          = "value";
    public static final String INTERFACE_NAME_ATTRIBUTE = "interfacename";

    public ValueElement (String category, String name)
    {
        super (category, name);
    }

    public String getType ()
    {
        return getAttribute (TYPE_ATTRIBUTE);
    }

    public void setType (String type)
    {
        setAttribute (TYPE_ATTRIBUTE, type);
    }

    public boolean hasType ()
    {
        return ! getType ().isEmpty ();
    }

    public String getValueString ()
    {
        return getAttribute (VALUE_ATTRIBUTE);
    }

    public void setValueString (String value)
    {
        setAttribute (VALUE_ATTRIBUTE, value);
    }

    public boolean hasValueString ()
    {
        return hasAttribute (VALUE_ATTRIBUTE);
    }

    public String getInterfaceName ()
    {
        return getAttribute (INTERFACE_NAME_ATTRIBUTE);
    }

    public void setInterfaceName (String interfaceName)
    {
        setAttribute (INTERFACE_NAME_ATTRIBUTE, interfaceName);
    }

    public boolean hasInterfaceName ()
    {
        return ! getInterfaceName ().isEmpty ();
    }

    public void removeInterfaceName ()
    {
        removeAttribute (INTERFACE_NAME_ATTRIBUTE);
    }

    public boolean validate (StringBuilder message)
    {
        boolean result = validateRequire (hasType (), message, "Missing type");
        return super.validate (message)  &&  result;
    }
}
