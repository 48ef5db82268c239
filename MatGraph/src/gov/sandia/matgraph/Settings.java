/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.log4j.Logger;

/**
    Library-wide tuning values.
    Defaults come from the classpath resource matgraph.properties. Any key may be overridden
    by a JVM system property of the same name with the prefix "matgraph.", for example
    -Dmatgraph.flatten.separator=__
    Values are read once, when this class is first loaded. Tests and embedding applications
    may also assign the public fields directly.
**/
public class Settings
{
    public static final String RESOURCE = "matgraph.properties";
    public static final String PREFIX   = "matgraph.";

    public static String  flattenSeparator;   // Joins implementation name and inner node name when minting names during flattening.
    public static int     firstNameSuffix;    // Numeric suffix tried first when a requested child name is already taken.
    public static boolean strictInputTypes;   // Reject NodeDef candidates whose declared input types disagree with the node. Off by default.

    protected static Properties properties = new Properties ();
    private static Logger logger = Logger.getLogger (Settings.class);

    static
    {
        try (InputStream stream = Settings.class.getClassLoader ().getResourceAsStream (RESOURCE))
        {
            if (stream == null) logger.warn ("No " + RESOURCE + " on classpath. Using built-in defaults.");
            else                properties.load (stream);
        }
        catch (IOException e)
        {
            logger.warn ("Failed to read " + RESOURCE + ". Using built-in defaults.", e);
        }
        reset ();
    }

    /**
        Restores every field to the value given by the properties resource and system overrides.
    **/
    public static void reset ()
    {
        flattenSeparator = get ("flatten.separator", "_");
        firstNameSuffix  = getInt ("names.firstSuffix", 2);
        if (firstNameSuffix < 1)
        {
            logger.warn ("Setting names.firstSuffix must be positive, not " + firstNameSuffix);
            firstNameSuffix = 2;
        }
        strictInputTypes = getBoolean ("nodedef.strictInputTypes", false);
    }

    public static String get (String key, String defaultValue)
    {
        String value = System.getProperty (PREFIX + key);
        if (value == null) value = properties.getProperty (key);
        if (value == null) return defaultValue;
        return value.trim ();
    }

    public static int getInt (String key, int defaultValue)
    {
        String value = get (key, "");
        if (value.isEmpty ()) return defaultValue;
        try
        {
            return Integer.parseInt (value);
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Setting " + key + " is not an integer: " + value);
            return defaultValue;
        }
    }

    public static boolean getBoolean (String key, boolean defaultValue)
    {
        String value = get (key, "");
        if (value.isEmpty ()) return defaultValue;
        if (value.equals ("1")) return true;
        return Boolean.parseBoolean (value);
    }
}
