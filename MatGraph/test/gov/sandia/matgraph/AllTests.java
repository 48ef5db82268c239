/*
Copyright 2026 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.matgraph;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

@RunWith(Suite.class)
@SuiteClasses({
    SettingsTest.class,
    gov.sandia.matgraph.db.ElementTest.class,
    gov.sandia.matgraph.graph.ConnectionTest.class,
    gov.sandia.matgraph.graph.SignatureTest.class,
    gov.sandia.matgraph.graph.FlattenTest.class,
    gov.sandia.matgraph.graph.TopologicalSortTest.class,
    gov.sandia.matgraph.graph.DocumentTest.class
})

public class AllTests {}
