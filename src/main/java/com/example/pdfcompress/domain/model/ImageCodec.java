package com.example.pdfcompress.domain.model;

/**
 * Encoding of an image XObject as declared by its {@code Filter} entry.
 */
public enum ImageCodec {
    DCT("DCTDecode"),
    JPX("JPXDecode"),
    FLATE("FlateDecode"),
    LZW("LZWDecode"),
    RUN_LENGTH("RunLengthDecode"),
    CCITT_FAX("CCITTFaxDecode"),
    JBIG2("JBIG2Decode"),
    UNFILTERED(null),
    OTHER(null);

    private final String filterName;

    ImageCodec(String filterName) {
        this.filterName = filterName;
    }

	/**
	 * Maps a PDF filter name to a codec; abbreviated inline-image names are accepted too.
	 *
	 * @param filterName filter name without the leading slash, may be {@code null}
	 * @return matching codec, {@link #UNFILTERED} for {@code null}, {@link #OTHER} when unknown
	 */
    public static ImageCodec fromFilterName(String filterName) {
        if (filterName == null) {
            return UNFILTERED;
        }
        for (ImageCodec codec : values()) {
            if (filterName.equals(codec.filterName)) {
                return codec;
            }
        }
        return switch (filterName) {
            case "DCT" -> DCT;
            case "Fl" -> FLATE;
            case "LZW" -> LZW;
            case "RL" -> RUN_LENGTH;
            case "CCF" -> CCITT_FAX;
            default -> OTHER;
        };
    }

    /**
     * Wavelet codecs are already efficient; they are only recompressed at the highest level.
     */
    public boolean isWavelet() {
        return this == JPX;
    }

    public boolean isBilevel() {
        return this == CCITT_FAX || this == JBIG2;
    }
}
