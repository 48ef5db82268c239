/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph.db;

/**
    Structural misuse of the element tree, such as a duplicate sibling name.
    Lookups that simply fail to find something return null instead of throwing this.
**/
@SuppressWarnings("serial")
public class DataModelException extends RuntimeException
{
    public Element element;  // Where the problem was detected. May be null.

    public DataModelException (String message)
    {
        super (message);
    }

    public DataModelException (Element element, String message)
    {
        super (message);
        this.element = element;
    }

    public DataModelException (String message, Throwable cause)
    {
        super (message, cause);
    }
}
