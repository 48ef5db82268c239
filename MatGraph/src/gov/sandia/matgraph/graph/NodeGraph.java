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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

/**
    A container of nodes with its own boundary ports.
    At the document level it is a reusable subgraph. With its nodedef attribute set, it is the
    structural implementation of that NodeDef for its target, and any node matching the NodeDef
    can be replaced by a copy of this graph's internals. See flattenSubgraphs(String).
    A graph is itself a node, so siblings may connect to it by name.
**/
public class NodeGraph extends Node
{
    public static final String CATEGORY           = "nodegraph";
    public static final String NODE_DEF_ATTRIBUTE = "nodedef";

    private static Logger logger = Logger.getLogger (NodeGraph.class);

    public NodeGraph (String name)
    {
        super (CATEGORY, name);
    }

    protected NodeGraph (String category, String name)
    {
        super (category, name);
    }

    public Element newInstance (String name)
    {
        return new NodeGraph (name);
    }

    protected boolean requiresType ()
    {
        return false;
    }

    // Nodes -------------------------------------------------------------------

    /**
        @param name If null or empty, a fresh name is derived from the category.
        @throws DataModelException if the name is already taken.
    **/
    public Node addNode (String category, String name)
    {
        if (name == null  ||  name.isEmpty ()) name = createValidChildName (category + "1");
        Node result = new Node (category, name);
        addChild (result);
        return result;
    }

    public Node addNode (String category, String name, String type)
    {
        Node result = addNode (category, name);
        if (type != null  &&  ! type.isEmpty ()) result.setType (type);
        return result;
    }

    public Node getNode (String name)
    {
        return getChildOfType (Node.class, name);
    }

    /**
        @return Our internal nodes in document order. Nested graphs are included, since they are nodes too.
    **/
    public List<Node> getNodes ()
    {
        return getChildrenOfType (Node.class);
    }

    /**
        Removes the named node. Ports elsewhere that name it are left dangling.
    **/
    public void removeNode (String name)
    {
        if (getNode (name) != null) removeChild (name);
    }

    // Implementation binding --------------------------------------------------

    public String getNodeDefString ()
    {
        return getAttribute (NODE_DEF_ATTRIBUTE);
    }

    public void setNodeDefString (String nodeDef)
    {
        setAttribute (NODE_DEF_ATTRIBUTE, nodeDef);
    }

    /**
        @return The NodeDef this graph implements, or null if none is named or it can't be found.
    **/
    public NodeDef getNodeDef ()
    {
        String nodeDefName = getNodeDefString ();
        if (nodeDefName.isEmpty ()) return null;
        Document document = Document.of (this);
        if (document == null) return null;
        return document.getNodeDef (nodeDefName);
    }

    // Flattening --------------------------------------------------------------

    /**
        Replaces every node whose implementation for the given target is a NodeGraph with a copy
        of that graph's internal nodes, repeating on the copies until no such node remains.
        Nodes that have no graph implementation for the target are left exactly as they were.

        Work is driven by a FIFO queue rather than recursion, so the nesting depth of
        implementations has no effect on the call stack.

        An implementation that would end up expanding inside its own expansion (directly or
        through several layers) is not inlined again. The node that would do so is left in place
        and a warning is logged. Without this check the queue would never drain.

        @param target Implementations are matched against this string exactly.
        @return The number of reference nodes that were replaced.
    **/
    public int flattenSubgraphs (String target)
    {
        // For each queued node, the set of implementation graphs it was expanded out of.
        Map<Node,Set<NodeGraph>> lineage = new HashMap<Node,Set<NodeGraph>> ();
        Set<NodeGraph> top = new HashSet<NodeGraph> ();
        top.add (this);

        LinkedList<Node> queue = new LinkedList<Node> (getNodes ());
        for (Node n : queue) lineage.put (n, top);

        int expanded = 0;
        while (! queue.isEmpty ())
        {
            Node refNode = queue.removeFirst ();
            InterfaceElement implement = refNode.getImplementation (target);
            if (! (implement instanceof NodeGraph)) continue;
            NodeGraph subGraph = (NodeGraph) implement;

            Set<NodeGraph> ancestry = lineage.remove (refNode);
            if (ancestry.contains (subGraph))
            {
                logger.warn ("Implementation " + subGraph.getName () + " expands into itself. Leaving " + refNode.getNamePath () + " unflattened.");
                continue;
            }
            Set<NodeGraph> subAncestry = new HashSet<NodeGraph> (ancestry);
            subAncestry.add (subGraph);

            NodeDef refDef = refNode.getReferencedNodeDef ();  // Supplies defaults for interface inputs that refNode leaves unset.
            Map<Node,Node> subNodeMap = new LinkedHashMap<Node,Node> ();

            //   Pass 1 -- Materialize a copy of each internal node, in document order, just ahead of refNode.
            for (Node origSubNode : subGraph.getNodes ())
            {
                String newName = createValidChildName (subGraph.getName () + Settings.flattenSeparator + origSubNode.getName ());
                Node newSubNode = (Node) origSubNode.newInstance (newName);
                addChild (newSubNode);
                newSubNode.copyContentFrom (origSubNode);
                setChildIndex (newName, getChildIndex (refNode.getName ()));

                // Transfer interface values from the reference node to the copy.
                for (ValueElement newValue : newSubNode.getChildrenOfType (ValueElement.class))
                {
                    if (! newValue.hasInterfaceName ()) continue;

                    String interfaceName = newValue.getInterfaceName ();
                    ValueElement refValue = refNode.getValueElement (interfaceName);
                    if (refValue != null)
                    {
                        if (refValue.hasValueString ()) newValue.setValueString (refValue.getValueString ());
                        if (newValue instanceof Input  &&  refValue instanceof Input)
                        {
                            Input refInput = (Input) refValue;
                            if (refInput.hasNodeName ()) ((Input) newValue).setNodeName (refInput.getNodeName ());
                        }
                    }
                    else if (refDef != null)
                    {
                        ValueElement declared = refDef.getValueElement (interfaceName);
                        if (declared != null  &&  declared.hasValueString ()) newValue.setValueString (declared.getValueString ());
                    }
                    newValue.removeInterfaceName ();
                }

                subNodeMap.put (origSubNode, newSubNode);

                // The copy may itself be implemented by a graph. If so, it gets its own turn in the queue.
                InterfaceElement subImplement = newSubNode.getImplementation (target);
                if (subImplement instanceof NodeGraph)
                {
                    queue.add (newSubNode);
                    lineage.put (newSubNode, subAncestry);
                }
            }

            //   Pass 2 -- Rewire connections.
            //   Internal edges are re-pointed from the original subnode to its copy.
            //   An original subnode that feeds a boundary output of subGraph takes over refNode's
            //   downstream ports in this graph.
            for (Map.Entry<Node,Node> pair : subNodeMap.entrySet ())
            {
                Node origSubNode = pair.getKey ();
                Node newSubNode  = pair.getValue ();
                for (PortElement origPort : origSubNode.getDownstreamPorts ())
                {
                    Element owner = origPort.getParent ();
                    if (origPort instanceof Input)
                    {
                        Node mapped = subNodeMap.get (owner);
                        if (mapped != null) mapped.setConnectedNode (origPort.getName (), newSubNode);
                    }
                    else if (origPort instanceof Output  &&  owner == subGraph)
                    {
                        for (PortElement outerPort : refNode.getDownstreamPorts ()) outerPort.setConnectedNode (newSubNode);
                    }
                }
            }

            //   refNode has been fully replaced.
            removeNode (refNode.getName ());
            expanded++;
            if (logger.isDebugEnabled ()) logger.debug ("Expanded " + refNode.getName () + " with " + subGraph.getName () + " into " + subNodeMap.size () + " nodes");
        }

        if (expanded > 0  &&  logger.isDebugEnabled ()) logger.debug ("Flattened " + expanded + " nodes in " + getNamePath () + " for target \"" + target + "\"");
        return expanded;
    }

    // Ordering ----------------------------------------------------------------

    /**
        Orders our children so that every child comes after everything it depends on.
        Uses Kahn's algorithm, which avoids recursion and runs in O(children + edges).
        Only dependencies between our own children count. A connection that resolves to a node
        in an enclosing scope is outside this graph, and so it does not constrain the order.
        Among children that are ready at the same moment, document order is kept, so the
        result is reproducible for identical input.
        @throws DataModelLoopException if the dependencies contain a cycle. No partial order is returned.
    **/
    public List<Element> topologicalSort ()
    {
        List<Element> children = getChildren ();

        // Calculate in-degrees for all children, and record who depends on whom.
        // A child that draws on the same upstream twice appears twice in its list, matching its in-degree.
        Map<Element,Integer>       inDegree   = new HashMap<Element,Integer> ();
        Map<Element,List<Element>> dependents = new HashMap<Element,List<Element>> ();
        LinkedList<Element>        queue      = new LinkedList<Element> ();
        for (Element child : children)
        {
            int count = 0;
            for (Edge e : child.getUpstreamEdges ())
            {
                Element upstream = e.getUpstreamElement ();
                if (upstream.getParent () != this) continue;
                count++;
                List<Element> list = dependents.get (upstream);
                if (list == null)
                {
                    list = new ArrayList<Element> ();
                    dependents.put (upstream, list);
                }
                list.add (child);
            }
            inDegree.put (child, count);
            if (count == 0) queue.add (child);
        }

        List<Element> result = new ArrayList<Element> (children.size ());
        while (! queue.isEmpty ())
        {
            Element child = queue.removeFirst ();
            result.add (child);

            // Release whatever depends on child.
            List<Element> list = dependents.get (child);
            if (list == null) continue;
            for (Element downstream : list)
            {
                int degree = inDegree.get (downstream) - 1;
                inDegree.put (downstream, degree);
                if (degree == 0) queue.add (downstream);
            }
        }

        if (result.size () != children.size ())
        {
            List<Element> unvisited = new ArrayList<Element> ();
            for (Element child : children) if (inDegree.get (child) > 0) unvisited.add (child);
            throw new DataModelLoopException (this, unvisited);
        }
        return result;
    }
}
