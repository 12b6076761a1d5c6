package cadence.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Properties;

public class Version {
    private static final Logger log = LoggerFactory.getLogger(Version.class);
    
    public static final String VERSION;
    
    static {
        var props = new Properties();
        try(var in = Version.class.getResourceAsStream("/cadence-version.properties")) {
            if(in != null) {
                props.load(in);
            }
        } catch(IOException e) {
            log.warn("Unable to read version information", e);
        }
        var v = props.getProperty("version", "");
        VERSION = v.isEmpty() || v.startsWith("$") ? "0.0.0-dev" : v;
    }
    
    private Version() {}
}
