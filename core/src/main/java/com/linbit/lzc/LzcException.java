package com.linbit.lzc;

import javax.annotation.Nullable;

/**
 * Base class of all checked exceptions thrown by the libzfs_core bindings.
 *
 * Besides the message, an LzcException may carry texts describing the problem, its cause,
 * a possible correction and additional details, as well as a numeric code. For failures
 * reported by libzfs_core, the numeric code is the errno value returned by the library.
 */
public class LzcException extends Exception
{
    private static final long serialVersionUID = 5240180373402312095L;

    private @Nullable String excDescription;
    private @Nullable String excCause;
    private @Nullable String excCorrection;
    private @Nullable String excDetails;

    private @Nullable Long excNumericCode;

    public LzcException(String message)
    {
        super(message);
    }

    public LzcException(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }

    public LzcException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText
    )
    {
        this(message, descriptionText, causeText, correctionText, detailsText, null);
    }

    public LzcException(
        String message,
        @Nullable String descriptionText,
        @Nullable String causeText,
        @Nullable String correctionText,
        @Nullable String detailsText,
        @Nullable Throwable cause
    )
    {
        super(message, cause);
        excDescription = descriptionText;
        excCause = causeText;
        excCorrection = correctionText;
        excDetails = detailsText;
    }

    /**
     * Returns a text that describes the problem for which the exception was generated
     *
     * @return Problem description, or null if no such information is available
     */
    public @Nullable String getDescriptionText()
    {
        return excDescription;
    }

    /**
     * Returns the text that describes what caused the problem
     *
     * @return Problem cause description, or null if no such information is available
     */
    public @Nullable String getCauseText()
    {
        return excCause;
    }

    /**
     * Returns the text that describes possible or recommended resolutions to the problem
     *
     * @return Correction instructions, or null if no such information is available
     */
    public @Nullable String getCorrectionText()
    {
        return excCorrection;
    }

    /**
     * Returns the text that contains additional information for error reports
     *
     * @return Additional information, or null if no such information is available
     */
    public @Nullable String getDetailsText()
    {
        return excDetails;
    }

    /**
     * Attaches a numeric error code
     *
     * @param errorCode Numeric error code for the problem being reported by this exception
     */
    protected void setNumericCode(@Nullable Long errorCode)
    {
        excNumericCode = errorCode;
    }

    /**
     * Returns the numeric error code for the problem
     *
     * @return Numeric error code, or null if none has been set
     */
    public @Nullable Long getNumericCode()
    {
        return excNumericCode;
    }
}
