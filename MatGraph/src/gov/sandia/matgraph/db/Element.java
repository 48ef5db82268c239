/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.db;

import gov.sandia.matgraph.Settings;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
    A named, categorized node in an ordered tree, carrying string attributes.
    This is the substrate on which the graph model is built. It knows nothing about
    connections beyond the upstream-edge hooks, which subclasses override.

    Ownership is strictly parent-to-child. The parent reference is a back link only.
    Any reference from one element to another that is not a parent/child relation
    must be stored as a name and resolved on demand.

    Sibling names are unique at all times. Children keep insertion order, which is
    the "document order" used to break ties throughout the library.

    This class is not thread-safe. Concurrent readers are fine as long as nobody writes.
**/
public class Element implements Iterable<Element>
{
    protected String               name;
    protected String               category;
    protected Element              parent;
    protected Map<String,String>   attributes = new LinkedHashMap<String,String> ();
    protected List<Element>        children   = new ArrayList<Element> ();
    protected Map<String,Element>  childMap   = new HashMap<String,Element> ();

    public Element (String category, String name)
    {
        this.category = category;
        this.name     = name;
    }

    /**
        Creates an empty element of the same Java class and category, suitable as a copy target.
        Subclasses must override this so that copyContentFrom() preserves their type.
    **/
    public Element newInstance (String name)
    {
        return new Element (category, name);
    }

    public String getName ()
    {
        return name;
    }

    /**
        Renames this element. If attached, the new name must not collide with a sibling.
        References to the old name held elsewhere in the document are not updated.
        Use a dangling-reference scan afterward if that matters.
    **/
    public void setName (String name)
    {
        if (name.equals (this.name)) return;
        if (parent != null)
        {
            if (parent.childMap.containsKey (name)) throw new DataModelException (this, "Element name is not unique: " + name);
            parent.childMap.remove (this.name);
            parent.childMap.put (name, this);
        }
        this.name = name;
    }

    public String getCategory ()
    {
        return category;
    }

    public Element getParent ()
    {
        return parent;
    }

    public Element getRoot ()
    {
        Element result = this;
        while (result.parent != null) result = result.parent;
        return result;
    }

    public int depth ()
    {
        int result = 0;
        for (Element p = parent; p != null; p = p.parent) result++;
        return result;
    }

    /**
        Names from just below the root down to this element, joined with "/".
        The root itself is not included. A detached element returns its own name.
    **/
    public String getNamePath ()
    {
        if (parent == null) return name;
        StringBuilder result = new StringBuilder (name);
        for (Element p = parent; p.parent != null; p = p.parent) result.insert (0, p.name + "/");
        return result.toString ();
    }

    // Attributes --------------------------------------------------------------

    public void setAttribute (String key, String value)
    {
        if (value == null) attributes.remove (key);
        else               attributes.put (key, value);
    }

    /**
        @return The attribute value, or "" if it is not set.
    **/
    public String getAttribute (String key)
    {
        String result = attributes.get (key);
        if (result == null) return "";
        return result;
    }

    public boolean hasAttribute (String key)
    {
        return attributes.containsKey (key);
    }

    public void removeAttribute (String key)
    {
        setAttribute (key, null);
    }

    public Set<String> getAttributeNames ()
    {
        return attributes.keySet ();
    }

    // Children ----------------------------------------------------------------

    /**
        Appends the given element to our children.
        @throws DataModelException if the child is already owned, has no name, or its name is taken.
    **/
    public void addChild (Element child)
    {
        if (child.parent != null)                 throw new DataModelException (child, "Element already has a parent: " + child.getNamePath ());
        if (child.name == null  ||  child.name.isEmpty ()) throw new DataModelException (this, "Child name is empty under " + getNamePath ());
        if (childMap.containsKey (child.name))    throw new DataModelException (this, "Child name is not unique: " + child.name);
        child.parent = this;
        children.add (child);
        childMap.put (child.name, child);
        getRoot ().attached (child);
    }

    /**
        @return The child with the given name, or null if it doesn't exist.
    **/
    public Element getChild (String name)
    {
        return childMap.get (name);
    }

    /**
        @return A snapshot of the children in document order. Changes to the returned list do not affect this element.
    **/
    public List<Element> getChildren ()
    {
        return new ArrayList<Element> (children);
    }

    public int childCount ()
    {
        return children.size ();
    }

    @SuppressWarnings("unchecked")
    public <T extends Element> List<T> getChildrenOfType (Class<T> type)
    {
        List<T> result = new ArrayList<T> ();
        for (Element c : children) if (type.isInstance (c)) result.add ((T) c);
        return result;
    }

    /**
        @return The named child if it exists and is of the given type, otherwise null.
    **/
    @SuppressWarnings("unchecked")
    public <T extends Element> T getChildOfType (Class<T> type, String name)
    {
        Element c = childMap.get (name);
        if (type.isInstance (c)) return (T) c;
        return null;
    }

    /**
        @return Position of the named child in document order, or -1 if it doesn't exist.
    **/
    public int getChildIndex (String name)
    {
        Element c = childMap.get (name);
        if (c == null) return -1;
        return children.indexOf (c);
    }

    /**
        Moves the named child to the given position. Children at or after that position shift toward the end.
        The index is clamped to the valid range. Does nothing if the child doesn't exist.
    **/
    public void setChildIndex (String name, int index)
    {
        Element c = childMap.get (name);
        if (c == null) return;
        children.remove (c);
        if (index < 0) index = 0;
        if (index > children.size ()) index = children.size ();
        children.add (index, c);
    }

    /**
        Detaches the named child. Name references to it held elsewhere are left dangling.
        @return The removed child, or null if it didn't exist.
    **/
    public Element removeChild (String name)
    {
        Element c = childMap.get (name);
        if (c == null) return null;
        getRoot ().detached (c);
        childMap.remove (name);
        children.remove (c);
        c.parent = null;
        return c;
    }

    public void clearChildren ()
    {
        Element root = getRoot ();
        for (Element c : children)
        {
            root.detached (c);
            c.parent = null;
        }
        children.clear ();
        childMap.clear ();
    }

    /**
        Notifies the root of a tree that a subtree has just joined it.
        A root that keeps an index over its descendants overrides this and detached(Element).
    **/
    protected void attached (Element subtree)
    {
    }

    /**
        Notifies the root of a tree that a subtree is about to leave it. The subtree is still attached during this call.
    **/
    protected void detached (Element subtree)
    {
    }

    // Names -------------------------------------------------------------------

    /**
        Replaces every character that is not a letter, digit or underscore with an underscore.
    **/
    public static String createValidName (String name)
    {
        StringBuilder result = new StringBuilder (name.length ());
        for (int i = 0; i < name.length (); i++)
        {
            char c = name.charAt (i);
            if (Character.isLetterOrDigit (c)  ||  c == '_') result.append (c);
            else                                              result.append ('_');
        }
        return result.toString ();
    }

    /**
        Increments the trailing integer of a name, or appends the configured first suffix if there is none.
        "add" --> "add2", "add2" --> "add3", "layer_9" --> "layer_10"
    **/
    public static String incrementName (String name)
    {
        int split = name.length ();
        while (split > 0  &&  Character.isDigit (name.charAt (split - 1))) split--;
        int digits = name.length () - split;
        if (digits == 0  ||  digits > 9) return name + Settings.firstNameSuffix;  // More than 9 digits could overflow an int, so treat as plain text.
        int number = Integer.parseInt (name.substring (split));
        return name.substring (0, split) + (number + 1);
    }

    /**
        Returns a name, derived from the given one, which no current child uses.
        Never hands back a name that is already taken.
    **/
    public String createValidChildName (String name)
    {
        name = createValidName (name);
        if (name.isEmpty ()) name = "_";
        while (childMap.containsKey (name)) name = incrementName (name);
        return name;
    }

    // Copying -----------------------------------------------------------------

    /**
        Deep copies attributes and children of the source into this element.
        Our own name and category are unchanged. Existing children are discarded.
        Attributes not present in the source are kept.
    **/
    public void copyContentFrom (Element source)
    {
        for (Map.Entry<String,String> a : source.attributes.entrySet ()) setAttribute (a.getKey (), a.getValue ());
        clearChildren ();
        for (Element sc : source.children)
        {
            Element c = sc.newInstance (sc.name);
            addChild (c);
            c.copyContentFrom (sc);
        }
    }

    // Dependencies ------------------------------------------------------------

    /**
        The number of slots that could carry an upstream dependency.
        Not every slot necessarily resolves. See getUpstreamEdge(int).
    **/
    public int getUpstreamEdgeCount ()
    {
        return 0;
    }

    /**
        @return The resolved edge at the given slot, or null if the slot is empty, dangling or out of range.
    **/
    public Edge getUpstreamEdge (int index)
    {
        return null;
    }

    public List<Edge> getUpstreamEdges ()
    {
        List<Edge> result = new ArrayList<Edge> ();
        int count = getUpstreamEdgeCount ();
        for (int i = 0; i < count; i++)
        {
            Edge e = getUpstreamEdge (i);
            if (e != null) result.add (e);
        }
        return result;
    }

    // Validation --------------------------------------------------------------

    /**
        Checks this element and everything below it.
        @param message Receives one line per problem found. May be null if only the verdict is needed.
        @return true if no problems were found.
    **/
    public boolean validate (StringBuilder message)
    {
        boolean result = true;
        for (Element c : children) result = c.validate (message)  &&  result;  // Keep going after a failure, so all findings are reported.
        return result;
    }

    protected boolean validateRequire (boolean expression, StringBuilder message, String error)
    {
        if (expression) return true;
        if (message != null) message.append (category + " " + getNamePath () + ": " + error + "\n");
        return false;
    }

    // Traversal ---------------------------------------------------------------

    public interface Visitor
    {
        /**
            @return true to recurse below current element. false if further recursion below this element is not needed.
        **/
        public boolean visit (Element element);
    }

    /**
        Execute some operation on each element in the tree. Traversal is depth-first, in document order.
    **/
    public void visit (Visitor v)
    {
        if (! v.visit (this)) return;
        for (Element c : this) c.visit (v);
    }

    /**
        Iterates over a snapshot of the children, so the caller may add or remove children during iteration.
    **/
    public Iterator<Element> iterator ()
    {
        return getChildren ().iterator ();
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append ("<" + category + " name=\"" + name + "\"");
        for (Map.Entry<String,String> a : attributes.entrySet ()) result.append (" " + a.getKey () + "=\"" + a.getValue () + "\"");
        result.append (">");
        return result.toString ();
    }
}
