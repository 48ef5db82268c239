/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

import java.util.List;

/**
    An element that presents a typed interface made of ports.
    Base for nodes, graphs, node definitions and implementations.
**/
public abstract class InterfaceElement extends Element
{
    public static final String TYPE_ATTRIBUTE   = "type";
    public static final String TARGET_ATTRIBUTE = "target";

    public InterfaceElement (String category, String name)
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

    public String getTarget ()
    {
        return getAttribute (TARGET_ATTRIBUTE);
    }

    public void setTarget (String target)
    {
        setAttribute (TARGET_ATTRIBUTE, target);
    }

    // Inputs

    /**
        @param type May be null or empty, in which case the type is left unset.
        @throws DataModelException if a child with the given name already exists.
    **/
    public Input addInput (String name, String type)
    {
        Input result = new Input (name);
        if (type != null  &&  ! type.isEmpty ()) result.setType (type);
        addChild (result);
        return result;
    }

    public Input getInput (String name)
    {
        return getChildOfType (Input.class, name);
    }

    public List<Input> getInputs ()
    {
        return getChildrenOfType (Input.class);
    }

    public void removeInput (String name)
    {
        if (getInput (name) != null) removeChild (name);
    }

    // Outputs

    public Output addOutput (String name, String type)
    {
        Output result = new Output (name);
        if (type != null  &&  ! type.isEmpty ()) result.setType (type);
        addChild (result);
        return result;
    }

    public Output getOutput (String name)
    {
        return getChildOfType (Output.class, name);
    }

    public List<Output> getOutputs ()
    {
        return getChildrenOfType (Output.class);
    }

    public void removeOutput (String name)
    {
        if (getOutput (name) != null) removeChild (name);
    }

    // Parameters

    public Parameter addParameter (String name, String type)
    {
        Parameter result = new Parameter (name);
        if (type != null  &&  ! type.isEmpty ()) result.setType (type);
        addChild (result);
        return result;
    }

    public Parameter getParameter (String name)
    {
        return getChildOfType (Parameter.class, name);
    }

    public List<Parameter> getParameters ()
    {
        return getChildrenOfType (Parameter.class);
    }

    public void removeParameter (String name)
    {
        if (getParameter (name) != null) removeChild (name);
    }

    /**
        @return The input, output or parameter with the given name, or null.
    **/
    public ValueElement getValueElement (String name)
    {
        return getChildOfType (ValueElement.class, name);
    }
}
