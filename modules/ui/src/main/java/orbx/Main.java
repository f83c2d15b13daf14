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
package orbx;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import orbx.ui.LogHandler;
import orbx.ui.ViewCommand;
import org.apache.commons.lang3.time.StopWatch;

/**
 * The Main class is the entry point to the command line version of OrbX.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /** Banner printed at start up. */
  static final String border =
      " ______________________________________________________________________________";

  static final String title = "\n                       OrbX: Molecular Orbital Visualization";

  private Main() {
  }

  /**
   * Run OrbX.
   *
   * @param args -D properties followed by the command line of {@link ViewCommand}.
   */
  public static void main(String[] args) {
    int status = run(args);
    System.exit(status);
  }

  /**
   * Run OrbX without exiting the JVM.
   *
   * @param args -D properties followed by the command line of {@link ViewCommand}.
   * @return the exit status.
   */
  public static int run(String[] args) {
    args = processProperties(args);
    startLogging();
    header(args);
    StopWatch stopWatch = StopWatch.createStarted();
    int status = ViewCommand.commandLine(new ViewCommand()).execute(args);
    logger.fine(format(" Finished in %d ms with status %d.", stopWatch.getTime(), status));
    return status;
  }

  private static void header(String[] args) {
    StringBuilder sb = new StringBuilder();
    sb.append(border).append("\n");
    sb.append(title).append("\n");
    sb.append(border);
    sb.append("\n ").append(new Date());
    if (args != null && args.length > 0) {
      sb.append("\n\n Command line arguments:\n ");
      sb.append(Arrays.toString(args));
      sb.append("\n");
    }
    logger.info(sb.toString());
  }

  /** Process any "-D" command line flags. */
  static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        int equalsPosition = arg.indexOf('=');
        if (equalsPosition >= 0) {
          System.setProperty(arg.substring(0, equalsPosition), arg.substring(equalsPosition + 1));
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }

  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    Logger orbxLogger = Logger.getLogger("orbx");
    for (Handler handler : orbxLogger.getHandlers()) {
      orbxLogger.removeHandler(handler);
    }

    // Retrieve the log level from the orbx.log system property.
    String logLevel = System.getProperty("orbx.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }
    LogHandler logHandler = new LogHandler();
    logHandler.setLevel(level);
    orbxLogger.addHandler(logHandler);
    orbxLogger.setLevel(level);
  }
}
