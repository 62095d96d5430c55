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

package edu.cmu.causalinfo.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes diagnostic events to an SLF4J logger. Missing links and dropped sources go out at warn level, everything
 * else at info.
 *
 * @author Joseph Ramsey
 */
public class LoggingDiagnosticSink implements DiagnosticSink {
    private final Logger logger;

    public LoggingDiagnosticSink() {
        this(LoggerFactory.getLogger(LoggingDiagnosticSink.class));
    }

    public LoggingDiagnosticSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void report(DiagnosticEvent event) {
        switch (event.getType()) {
            case NOT_LINKED:
            case SOURCE_DROPPED:
                logger.warn("{}", event.getMessage());
                break;
            default:
                logger.info("{}", event.getMessage());
        }
    }
}
