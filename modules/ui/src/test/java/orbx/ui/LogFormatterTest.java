// ******************************************************************************
//
// Title:       OrbX.
// Description: OrbX - Software for Molecular Orbital Visualization.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of OrbX.
//
// OrbX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// OrbX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// OrbX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package orbx.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import orbx.utilities.OrbXTest;
import org.junit.Test;

/**
 * Test the console log format.
 *
 * @author Michael J. Schnieders
 */
public class LogFormatterTest extends OrbXTest {

  @Test
  public void testInfoIsMessageOnly() {
    LogRecord record = new LogRecord(Level.INFO, " Opened {0} as {1}.");
    record.setParameters(new Object[] {"h2.molden", "Molden"});
    String line = new LogFormatter(false).format(record);
    assertEquals(" Opened h2.molden as Molden." + System.lineSeparator(), line);
  }

  @Test
  public void testWarningsCarryLevel() {
    LogRecord record = new LogRecord(Level.WARNING, " Orbital 2 is skipped.");
    String line = new LogFormatter(false).format(record);
    assertTrue(line.contains("WARNING"));
    assertTrue(line.contains(" Orbital 2 is skipped."));
  }

  @Test
  public void testHandlerPublishes() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    LogHandler handler = new LogHandler(out, false);
    handler.setLevel(Level.INFO);
    handler.publish(new LogRecord(Level.INFO, " Evaluating density."));
    handler.publish(new LogRecord(Level.FINE, " Hidden."));
    handler.close();
    assertEquals(" Evaluating density." + System.lineSeparator(),
        bytes.toString(StandardCharsets.UTF_8));
  }
}
