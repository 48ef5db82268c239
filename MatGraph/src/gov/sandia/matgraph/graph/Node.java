/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.Settings;
import gov.sandia.matgraph.db.Edge;
import gov.sandia.matgraph.db.Element;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
    An instance of some operation. The category names the operation (for example "add" or "image")
    and together with the type forms the signature used to look up a NodeDef.
    A node holds no reference to its NodeDef or Implementation. Those are found by signature
    match each time they are requested, so editing the document never leaves a stale binding.
**/
public class Node extends InterfaceElement
{
    private static Logger logger = Logger.getLogger (Node.class);

    public Node (String category, String name)
    {
        super (category, name);
    }

    public Element newInstance (String name)
    {
        return new Node (category, name);
    }

    // Connections -------------------------------------------------------------

    /**
        Connects the named input to the given node, creating the input if necessary.
        A newly created input takes its type from the upstream node.
        @param node If null, the input (if it exists) is disconnected.
        @return The input that holds the connection.
    **/
    public Input setConnectedNode (String inputName, Node node)
    {
        Input input = getInput (inputName);
        if (input == null) input = addInput (inputName, node == null ? null : node.getType ());
        input.setConnectedNode (node);
        return input;
    }

    /**
        @return The node connected to the named input, or null if the input doesn't exist or its connection doesn't resolve.
    **/
    public Node getConnectedNode (String inputName)
    {
        Input input = getInput (inputName);
        if (input == null) return null;
        return input.getConnectedNode ();
    }

    /**
        Stores a connection by name, creating the input if necessary. The name need not resolve yet.
    **/
    public Input setConnectedNodeName (String inputName, String nodeName)
    {
        Input input = getInput (inputName);
        if (input == null) input = addInput (inputName, null);
        input.setNodeName (nodeName);
        return input;
    }

    /**
        @return The stored connection name, or "" if the input doesn't exist or is unconnected.
    **/
    public String getConnectedNodeName (String inputName)
    {
        Input input = getInput (inputName);
        if (input == null) return "";
        return input.getNodeName ();
    }

    public int getUpstreamEdgeCount ()
    {
        return getInputs ().size ();
    }

    public Edge getUpstreamEdge (int index)
    {
        List<Input> inputs = getInputs ();
        if (index < 0  ||  index >= inputs.size ()) return null;
        Input input = inputs.get (index);
        Node upstream = input.getConnectedNode ();
        if (upstream == null) return null;
        return new Edge (this, input, upstream);
    }

    public List<Edge> getUpstreamEdges ()
    {
        List<Edge> result = new ArrayList<Edge> ();
        for (Input input : getInputs ())
        {
            Node upstream = input.getConnectedNode ();
            if (upstream != null) result.add (new Edge (this, input, upstream));
        }
        return result;
    }

    /**
        Finds every port in the document that is connected to this node.
        Candidates are collected by name, then confirmed by resolving each one, so a same-named
        node in some other scope does not produce false matches.
        @return Ports in the order they were connected to us. Empty if this node is not part of a document.
    **/
    public List<PortElement> getDownstreamPorts ()
    {
        List<PortElement> result = new ArrayList<PortElement> ();
        Document document = Document.of (this);
        if (document == null) return result;
        for (PortElement port : document.getMatchingPorts (name))
        {
            if (port.getConnectedNode () == this) result.add (port);
        }
        return result;
    }

    // Signature lookup --------------------------------------------------------

    /**
        Finds the first NodeDef, in document order, whose node category and type match ours.
        For each of our inputs that the candidate also declares, the two types are compared.
        A disagreement is logged but does not disqualify the candidate, unless
        Settings.strictInputTypes is turned on. The lenient policy is what existing documents
        rely on, so it stays the default.
        @return The matching NodeDef, or null if there is none or we are not part of a document.
    **/
    public NodeDef getReferencedNodeDef ()
    {
        Document document = Document.of (this);
        if (document == null) return null;
        String type = getType ();
        for (NodeDef nodeDef : document.getMatchingNodeDefs (category))
        {
            if (! nodeDef.getType ().equals (type)) continue;

            boolean mismatch = false;
            for (Input input : getInputs ())
            {
                ValueElement declared = nodeDef.getValueElement (input.getName ());
                if (declared == null  ||  declared.getType ().equals (input.getType ())) continue;
                mismatch = true;
                if (logger.isDebugEnabled ()) logger.debug ("Input " + input.getNamePath () + " has type " + input.getType () + " but " + nodeDef.getName () + " declares " + declared.getType ());
            }
            if (mismatch  &&  Settings.strictInputTypes) continue;
            return nodeDef;
        }
        return null;
    }

    /**
        Finds the first implementation, in document order, of our NodeDef for the given target.
        @return Either an Implementation (opaque code reference) or a NodeGraph. Null if
        there is no NodeDef or no implementation for the target.
    **/
    public InterfaceElement getImplementation (String target)
    {
        NodeDef nodeDef = getReferencedNodeDef ();
        if (nodeDef == null) return null;
        Document document = Document.of (this);
        for (InterfaceElement implementation : document.getMatchingImplementations (nodeDef.getName ()))
        {
            if (implementation.getTarget ().equals (target)) return implementation;
        }
        return null;
    }

    /**
        Graphs override this, since they are typed by their outputs.
    **/
    protected boolean requiresType ()
    {
        return true;
    }

    public boolean validate (StringBuilder message)
    {
        boolean result = validateRequire (hasType ()  ||  ! requiresType (), message, "Missing type");
        return super.validate (message)  &&  result;
    }
}
