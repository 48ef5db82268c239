/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import gov.sandia.matgraph.db.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

/**
    Root of a material document. It is the outermost graph scope, so nodes placed directly
    in the document connect to each other the same way nodes inside a graph do.
    It also serves as the registry of NodeDefs, Implementations and NodeGraphs, and answers
    the document-wide lookups that the rest of the model depends on.
**/
public class Document extends NodeGraph
{
    public static final String CATEGORY = "materialx";

    protected Map<String,Set<PortElement>> portIndex = new HashMap<String,Set<PortElement>> ();  // node name --> every port in the document that stores it

    private static Logger logger = Logger.getLogger (Document.class);

    public Document ()
    {
        this ("");
    }

    public Document (String name)
    {
        super (CATEGORY, name);
    }

    public Element newInstance (String name)
    {
        return new Document (name);
    }

    /**
        @return The document that the given element belongs to, or null if its root is not a document.
    **/
    public static Document of (Element element)
    {
        Element root = element.getRoot ();
        if (root instanceof Document) return (Document) root;
        return null;
    }

    // NodeDefs

    /**
        @param node The node category that this definition applies to.
    **/
    public NodeDef addNodeDef (String name, String type, String node)
    {
        NodeDef result = new NodeDef (name);
        if (type != null  &&  ! type.isEmpty ()) result.setType (type);
        result.setNodeString (node);
        addChild (result);
        return result;
    }

    public NodeDef getNodeDef (String name)
    {
        return getChildOfType (NodeDef.class, name);
    }

    public List<NodeDef> getNodeDefs ()
    {
        return getChildrenOfType (NodeDef.class);
    }

    public void removeNodeDef (String name)
    {
        if (getNodeDef (name) != null) removeChild (name);
    }

    /**
        @return Every NodeDef that applies to the given node category, in document order.
    **/
    public List<NodeDef> getMatchingNodeDefs (String nodeCategory)
    {
        List<NodeDef> result = new ArrayList<NodeDef> ();
        for (NodeDef nodeDef : getNodeDefs ())
        {
            if (nodeDef.getNodeString ().equals (nodeCategory)) result.add (nodeDef);
        }
        return result;
    }

    // Implementations

    public Implementation addImplementation (String name, String nodeDef, String target)
    {
        Implementation result = new Implementation (name);
        result.setNodeDefString (nodeDef);
        if (target != null  &&  ! target.isEmpty ()) result.setTarget (target);
        addChild (result);
        return result;
    }

    /**
        Looks up an implementation by its own name. Not to be confused with Node.getImplementation(String),
        which resolves by target.
    **/
    public Implementation findImplementation (String name)
    {
        return getChildOfType (Implementation.class, name);
    }

    public List<Implementation> getImplementations ()
    {
        return getChildrenOfType (Implementation.class);
    }

    public void removeImplementation (String name)
    {
        if (findImplementation (name) != null) removeChild (name);
    }

    /**
        @return Every Implementation and NodeGraph that names the given NodeDef, in document order.
    **/
    public List<InterfaceElement> getMatchingImplementations (String nodeDefName)
    {
        List<InterfaceElement> result = new ArrayList<InterfaceElement> ();
        for (Element c : children)
        {
            if      (c instanceof Implementation) {if (((Implementation) c).getNodeDefString ().equals (nodeDefName)) result.add ((Implementation) c);}
            else if (c instanceof NodeGraph)      {if (((NodeGraph)      c).getNodeDefString ().equals (nodeDefName)) result.add ((NodeGraph)      c);}
        }
        return result;
    }

    // NodeGraphs

    public NodeGraph addNodeGraph (String name)
    {
        if (name == null  ||  name.isEmpty ()) name = createValidChildName ("nodegraph1");
        NodeGraph result = new NodeGraph (name);
        addChild (result);
        return result;
    }

    public NodeGraph getNodeGraph (String name)
    {
        return getChildOfType (NodeGraph.class, name);
    }

    public List<NodeGraph> getNodeGraphs ()
    {
        return getChildrenOfType (NodeGraph.class);
    }

    public void removeNodeGraph (String name)
    {
        if (getNodeGraph (name) != null) removeChild (name);
    }

    // Ports

    /**
        Collects every port in the document whose stored connection name equals the given name.
        These are only candidates. Whether each one actually resolves to a particular node
        depends on its scope, so callers must confirm by resolving.
        Answered from an index, so the cost depends on the number of matches rather than the size of the document.
        @return A snapshot, in the order the ports acquired their current connection name.
    **/
    public List<PortElement> getMatchingPorts (String nodeName)
    {
        Set<PortElement> ports = portIndex.get (nodeName);
        if (ports == null) return new ArrayList<PortElement> ();
        return new ArrayList<PortElement> (ports);
    }

    void indexPort (PortElement port)
    {
        String nodeName = port.getNodeName ();
        if (nodeName.isEmpty ()) return;
        Set<PortElement> ports = portIndex.get (nodeName);
        if (ports == null)
        {
            ports = new LinkedHashSet<PortElement> ();
            portIndex.put (nodeName, ports);
        }
        ports.add (port);
    }

    void unindexPort (PortElement port)
    {
        String nodeName = port.getNodeName ();
        Set<PortElement> ports = portIndex.get (nodeName);
        if (ports == null) return;
        ports.remove (port);
        if (ports.isEmpty ()) portIndex.remove (nodeName);
    }

    protected void attached (Element subtree)
    {
        subtree.visit (new Visitor ()
        {
            public boolean visit (Element element)
            {
                if (element instanceof PortElement) indexPort ((PortElement) element);
                return true;
            }
        });
    }

    protected void detached (Element subtree)
    {
        subtree.visit (new Visitor ()
        {
            public boolean visit (Element element)
            {
                if (element instanceof PortElement) unindexPort ((PortElement) element);
                return true;
            }
        });
    }

    /**
        Finds ports whose connection name is set but no longer resolves.
        Removing or renaming an element never repairs references to it, so this is the
        way to discover the damage afterward.
    **/
    public List<PortElement> findDanglingPorts ()
    {
        final List<PortElement> result = new ArrayList<PortElement> ();
        visit (new Visitor ()
        {
            public boolean visit (Element element)
            {
                if (element instanceof PortElement  &&  ((PortElement) element).isDangling ()) result.add ((PortElement) element);
                return true;
            }
        });
        if (! result.isEmpty ()  &&  logger.isDebugEnabled ()) logger.debug ("Found " + result.size () + " dangling ports in " + name);
        return result;
    }
}
