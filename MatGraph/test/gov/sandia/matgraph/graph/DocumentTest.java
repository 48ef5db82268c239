/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import gov.sandia.matgraph.db.DataModelException;

import org.junit.Test;

public class DocumentTest
{
    @Test
    public void testRegistry ()
    {
        Document doc = new Document ("doc");
        NodeDef   def   = doc.addNodeDef ("ND_add_float", "float", "add");
        NodeGraph graph = doc.addNodeGraph ("NG_add");
        Node      node  = doc.addNode ("add", "n", "float");

        assertSame (def,   doc.getNodeDef ("ND_add_float"));
        assertSame (graph, doc.getNodeGraph ("NG_add"));
        assertSame (node,  doc.getNode ("n"));
        assertEquals (1, doc.getNodeDefs ().size ());
        assertEquals (1, doc.getNodeGraphs ().size ());
        assertEquals (2, doc.getNodes ().size ());  // A graph is a node too.

        // Typed lookups don't cross categories.
        assertNull (doc.getNodeDef ("NG_add"));
        assertNull (doc.getNodeGraph ("n"));
        doc.removeNodeDef ("n");
        assertSame (node, doc.getNode ("n"));

        assertSame (doc, Document.of (node.addInput ("in1", "float")));
        assertNull (Document.of (new Node ("add", "loose")));
    }

    @Test
    public void testGeneratedNames ()
    {
        Document doc = new Document ("doc");
        NodeGraph a = doc.addNodeGraph ("");
        NodeGraph b = doc.addNodeGraph (null);
        assertEquals ("nodegraph1", a.getName ());
        assertEquals ("nodegraph2", b.getName ());

        Node n1 = a.addNode ("add", "");
        Node n2 = a.addNode ("add", "");
        assertEquals ("add1", n1.getName ());
        assertEquals ("add2", n2.getName ());
    }

    @Test(expected = DataModelException.class)
    public void testDuplicateNode ()
    {
        Document doc = new Document ("doc");
        NodeGraph g = doc.addNodeGraph ("G");
        g.addNode ("add", "n", "float");
        g.addNode ("multiply", "n", "float");
    }

    @Test(expected = DataModelException.class)
    public void testDuplicateInput ()
    {
        Node n = new Node ("add", "n");
        n.addInput ("in1", "float");
        n.addInput ("in1", "color3");
    }

    @Test
    public void testValidate ()
    {
        Document doc = new Document ("doc");
        doc.addNodeDef ("ND_add_float", "float", "add");
        NodeGraph g = doc.addNodeGraph ("G");
        Node n = g.addNode ("add", "n", "float");
        n.addInput ("in1", "float");
        doc.addImplementation ("IM_add", "ND_add_float", "glsl");

        StringBuilder message = new StringBuilder ();
        assertTrue (doc.validate (message));
        assertEquals ("", message.toString ());

        Node untyped = g.addNode ("add", "untyped");
        untyped.setConnectedNodeName ("in1", "n");
        doc.addNodeDef ("ND_broken", "", "");
        doc.addImplementation ("IM_broken", "", "glsl");

        message = new StringBuilder ();
        assertFalse (doc.validate (message));
        String report = message.toString ();
        assertTrue (report, report.contains ("add G/untyped: Missing type"));
        assertTrue (report, report.contains ("input G/untyped/in1: Missing type"));
        assertTrue (report, report.contains ("nodedef ND_broken: Missing node category"));
        assertTrue (report, report.contains ("nodedef ND_broken: Missing type"));
        assertTrue (report, report.contains ("implementation IM_broken: Missing nodedef"));
        assertEquals (5, report.split ("\n").length);

        // A null report still yields the verdict.
        assertFalse (doc.validate (null));
    }
}
