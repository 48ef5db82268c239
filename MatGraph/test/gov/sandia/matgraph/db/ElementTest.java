/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.db;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class ElementTest
{
    protected Element root;

    @Before
    public void setup ()
    {
        root = new Element ("root", "top");
        root.addChild (new Element ("item", "a"));
        root.addChild (new Element ("item", "b"));
        root.addChild (new Element ("item", "c"));
    }

    protected static List<String> names (List<Element> elements)
    {
        List<String> result = new ArrayList<String> ();
        for (Element e : elements) result.add (e.getName ());
        return result;
    }

    @Test
    public void testDuplicateChildRejected ()
    {
        try
        {
            root.addChild (new Element ("item", "b"));
            fail ("Expected duplicate name to be rejected");
        }
        catch (DataModelException e)
        {
            assertSame (root, e.element);
        }
        assertEquals (3, root.childCount ());
    }

    @Test(expected = DataModelException.class)
    public void testEmptyNameRejected ()
    {
        root.addChild (new Element ("item", ""));
    }

    @Test
    public void testRename ()
    {
        Element b = root.getChild ("b");
        b.setName ("renamed");
        assertNull (root.getChild ("b"));
        assertSame (b, root.getChild ("renamed"));
        assertEquals (1, root.getChildIndex ("renamed"));

        try
        {
            b.setName ("c");
            fail ("Expected collision to be rejected");
        }
        catch (DataModelException e)
        {
            assertEquals ("renamed", b.getName ());
        }
    }

    @Test
    public void testChildIndex ()
    {
        root.setChildIndex ("c", 0);
        assertEquals (List.of ("c", "a", "b"), names (root.getChildren ()));
        root.setChildIndex ("c", 99);
        assertEquals (List.of ("a", "b", "c"), names (root.getChildren ()));
        assertEquals (-1, root.getChildIndex ("missing"));
    }

    @Test
    public void testRemoveChild ()
    {
        Element b = root.removeChild ("b");
        assertNull (b.getParent ());
        assertEquals (List.of ("a", "c"), names (root.getChildren ()));
        assertNull (root.removeChild ("b"));

        // A removed child may be attached elsewhere.
        Element other = new Element ("root", "other");
        other.addChild (b);
        assertSame (other, b.getParent ());
    }

    @Test
    public void testCreateValidChildName ()
    {
        assertEquals ("d",     root.createValidChildName ("d"));
        assertEquals ("a2",    root.createValidChildName ("a"));
        assertEquals ("x_y_z", root.createValidChildName ("x.y z"));

        root.addChild (new Element ("item", "a2"));
        assertEquals ("a3", root.createValidChildName ("a"));
        assertEquals ("a3", root.createValidChildName ("a2"));
    }

    @Test
    public void testIncrementName ()
    {
        assertEquals ("add2",      Element.incrementName ("add"));
        assertEquals ("add3",      Element.incrementName ("add2"));
        assertEquals ("layer_10",  Element.incrementName ("layer_9"));
        assertEquals ("n12345678901" + "2", Element.incrementName ("n12345678901"));
    }

    @Test
    public void testNamePath ()
    {
        Element a = root.getChild ("a");
        Element leaf = new Element ("leaf", "x");
        a.addChild (leaf);
        assertEquals ("a/x", leaf.getNamePath ());
        assertEquals ("top", root.getNamePath ());
        assertEquals (2, leaf.depth ());
        assertSame (root, leaf.getRoot ());
    }

    @Test
    public void testAttributes ()
    {
        Element a = root.getChild ("a");
        assertEquals ("", a.getAttribute ("color"));
        assertFalse (a.hasAttribute ("color"));
        a.setAttribute ("color", "red");
        assertTrue (a.hasAttribute ("color"));
        a.setAttribute ("color", null);
        assertFalse (a.hasAttribute ("color"));
    }

    @Test
    public void testCopyContentFrom ()
    {
        Element source = root.getChild ("a");
        source.setAttribute ("color", "red");
        Element deep = new Element ("leaf", "x");
        deep.setAttribute ("size", "3");
        source.addChild (deep);

        Element copy = source.newInstance ("copy");
        root.addChild (copy);
        copy.copyContentFrom (source);

        assertEquals ("item", copy.getCategory ());
        assertEquals ("red",  copy.getAttribute ("color"));
        Element copiedDeep = copy.getChild ("x");
        assertNotSame (deep, copiedDeep);
        assertEquals ("3", copiedDeep.getAttribute ("size"));
        assertSame (copy, copiedDeep.getParent ());

        // The copy is independent of its source.
        copiedDeep.setAttribute ("size", "4");
        assertEquals ("3", deep.getAttribute ("size"));
    }

    @Test
    public void testIterationTolerantOfRemoval ()
    {
        int count = 0;
        for (Element c : root)
        {
            root.removeChild (c.getName ());
            count++;
        }
        assertEquals (3, count);
        assertEquals (0, root.childCount ());
    }

    @Test
    public void testVisitPrunes ()
    {
        root.getChild ("a").addChild (new Element ("leaf", "hidden"));
        final List<String> seen = new ArrayList<String> ();
        root.visit (new Element.Visitor ()
        {
            public boolean visit (Element element)
            {
                seen.add (element.getName ());
                return ! element.getName ().equals ("a");
            }
        });
        assertEquals (List.of ("top", "a", "b", "c"), seen);
    }

    @Test
    public void testNoUpstreamEdgesByDefault ()
    {
        assertEquals (0, root.getUpstreamEdgeCount ());
        assertNull (root.getUpstreamEdge (0));
        assertTrue (root.getUpstreamEdges ().isEmpty ());
    }
}
