///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 1998, 1999, 2000, 2001, 2002, 2003, 2004, 2005, 2006,       //
// 2007, 2008, 2009, 2010, 2014, 2015 by Peter Spirtes, Richard Scheines, Joseph   //
// Ramsey, and Clark Glymour.                                                //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package edu.cmu.causalinfo.test;

import edu.cmu.causalinfo.graph.InvalidNodeException;
import edu.cmu.causalinfo.graph.LaggedNode;
import edu.cmu.causalinfo.graph.NodeCodec;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestNodeCodec {

    @Test
    public void testEncode() {
        NodeCodec codec = new NodeCodec(2, 10);

        assertEquals(22, codec.getNumNodes());
        assertEquals(0, codec.encode(new LaggedNode(0, 0)));
        assertEquals(1, codec.encode(new LaggedNode(1, 0)));
        assertEquals(13, codec.encode(new LaggedNode(1, -6)));
        assertEquals(21, codec.encode(1, -10));
        assertEquals(new LaggedNode(1, -6), codec.decode(13));
    }

    @Test
    public void testRoundTrip() {
        NodeCodec codec = new NodeCodec(3, 4);

        for (int id = 0; id < codec.getNumNodes(); id++) {
            LaggedNode node = codec.decode(id);
            assertEquals(id, codec.encode(node));
            assertTrue(node.getLag() <= 0 && node.getLag() >= -4);
        }
    }

    @Test
    public void testIdOrderMatchesNodeOrder() {
        NodeCodec codec = new NodeCodec(3, 4);
        List<Integer> ids = new ArrayList<>();

        for (int id = codec.getNumNodes() - 1; id >= 0; id--) {
            ids.add(id);
        }

        SortedSet<LaggedNode> nodes = codec.decodeAll(ids);
        int expected = 0;

        for (LaggedNode node : nodes) {
            assertEquals(expected++, codec.encode(node));
        }
    }

    @Test
    public void testDecodePath() {
        NodeCodec codec = new NodeCodec(2, 3);
        List<LaggedNode> path = codec.decodePath(Arrays.asList(5, 2, 0));
        assertEquals(Arrays.asList(new LaggedNode(1, -2), new LaggedNode(0, -1), new LaggedNode(0, 0)), path);
    }

    @Test
    public void testRejectsBadNodes() {
        NodeCodec codec = new NodeCodec(2, 10);

        LaggedNode[] bad = {
                new LaggedNode(2, 0),
                new LaggedNode(-1, 0),
                new LaggedNode(0, 1),
                new LaggedNode(0, -11)
        };

        for (LaggedNode node : bad) {
            try {
                codec.encode(node);
                fail("Should have rejected " + node);
            } catch (InvalidNodeException e) {
                // Expected.
            }
        }
    }

    @Test(expected = InvalidNodeException.class)
    public void testRejectsIdPastEnd() {
        new NodeCodec(2, 10).decode(22);
    }

    @Test(expected = InvalidNodeException.class)
    public void testRejectsNegativeId() {
        new NodeCodec(2, 10).decode(-1);
    }

    @Test(expected = NullPointerException.class)
    public void testRejectsNull() {
        new NodeCodec(2, 10).checkNode(null);
    }

    @Test
    public void testInvalidNodeIsIllegalArgument() {
        try {
            new NodeCodec(1, 0).encode(0, -1);
            fail();
        } catch (IllegalArgumentException e) {
            assertTrue(e instanceof InvalidNodeException);
        }
    }
}
