package de.caluga.golden;

/**
 * Raised while a mapper is being set up, when its configuration cannot work: contradicting casing
 * directions, attribute types without a codec, nested relations that go too deep or objects that do not
 * expose the attributes the mapper was built for.
 * <p>
 * Never raised for bad input data, see {@link ValidationException} for that.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String msg) {
        super(msg);
    }

    public InvalidConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
