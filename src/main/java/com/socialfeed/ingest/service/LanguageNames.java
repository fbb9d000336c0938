package com.socialfeed.ingest.service;

import java.util.Map;

/**
 * Language code to English display name, used when telling the text-generation service which
 * language to write in.
 */
public final class LanguageNames {

    public static final String DEFAULT_LANGUAGE = "English";

    private static final Map<String, String> NAMES = Map.ofEntries(
            Map.entry("af", "Afrikaans"), Map.entry("sq", "Albanian"), Map.entry("am", "Amharic"), Map.entry("ar", "Arabic"),
            Map.entry("hy", "Armenian"), Map.entry("az", "Azerbaijani"), Map.entry("eu", "Basque"), Map.entry("be", "Belarusian"),
            Map.entry("bn", "Bengali"), Map.entry("bs", "Bosnian"), Map.entry("bg", "Bulgarian"), Map.entry("ca", "Catalan"),
            Map.entry("ceb", "Cebuano"), Map.entry("ny", "Chichewa"), Map.entry("zh-CN", "Chinese (Simplified)"), Map.entry("zh-TW", "Chinese (Traditional)"),
            Map.entry("co", "Corsican"), Map.entry("hr", "Croatian"), Map.entry("cs", "Czech"), Map.entry("da", "Danish"),
            Map.entry("nl", "Dutch"), Map.entry("en", "English"), Map.entry("eo", "Esperanto"), Map.entry("et", "Estonian"),
            Map.entry("tl", "Filipino"), Map.entry("fi", "Finnish"), Map.entry("fr", "French"), Map.entry("fy", "Frisian"),
            Map.entry("gl", "Galician"), Map.entry("ka", "Georgian"), Map.entry("de", "German"), Map.entry("el", "Greek"),
            Map.entry("gu", "Gujarati"), Map.entry("ht", "Haitian Creole"), Map.entry("ha", "Hausa"), Map.entry("haw", "Hawaiian"),
            Map.entry("he", "Hebrew"), Map.entry("hi", "Hindi"), Map.entry("hmn", "Hmong"), Map.entry("hu", "Hungarian"),
            Map.entry("is", "Icelandic"), Map.entry("ig", "Igbo"), Map.entry("id", "Indonesian"), Map.entry("ga", "Irish"),
            Map.entry("it", "Italian"), Map.entry("ja", "Japanese"), Map.entry("jw", "Javanese"), Map.entry("kn", "Kannada"),
            Map.entry("kk", "Kazakh"), Map.entry("km", "Khmer"), Map.entry("rw", "Kinyarwanda"), Map.entry("ko", "Korean"),
            Map.entry("ku", "Kurdish (Kurmanji)"), Map.entry("ky", "Kyrgyz"), Map.entry("lo", "Lao"), Map.entry("la", "Latin"),
            Map.entry("lv", "Latvian"), Map.entry("lt", "Lithuanian"), Map.entry("lb", "Luxembourgish"), Map.entry("mk", "Macedonian"),
            Map.entry("mg", "Malagasy"), Map.entry("ms", "Malay"), Map.entry("ml", "Malayalam"), Map.entry("mt", "Maltese"),
            Map.entry("mi", "Maori"), Map.entry("mr", "Marathi"), Map.entry("mn", "Mongolian"), Map.entry("my", "Myanmar (Burmese)"),
            Map.entry("ne", "Nepali"), Map.entry("no", "Norwegian"), Map.entry("ps", "Pashto"), Map.entry("fa", "Persian"),
            Map.entry("pl", "Polish"), Map.entry("pt", "Portuguese"), Map.entry("pa", "Punjabi"), Map.entry("ro", "Romanian"),
            Map.entry("ru", "Russian"), Map.entry("sm", "Samoan"), Map.entry("gd", "Scots Gaelic"), Map.entry("sr", "Serbian"),
            Map.entry("st", "Sesotho"), Map.entry("sn", "Shona"), Map.entry("sd", "Sindhi"), Map.entry("si", "Sinhala"),
            Map.entry("sk", "Slovak"), Map.entry("sl", "Slovenian"), Map.entry("so", "Somali"), Map.entry("es", "Spanish"),
            Map.entry("su", "Sundanese"), Map.entry("sw", "Swahili"), Map.entry("sv", "Swedish"), Map.entry("tg", "Tajik"),
            Map.entry("ta", "Tamil"), Map.entry("te", "Telugu"), Map.entry("th", "Thai"), Map.entry("tr", "Turkish"),
            Map.entry("uk", "Ukrainian"), Map.entry("ur", "Urdu"), Map.entry("uz", "Uzbek"), Map.entry("vi", "Vietnamese"),
            Map.entry("cy", "Welsh"), Map.entry("xh", "Xhosa"), Map.entry("yi", "Yiddish"), Map.entry("yo", "Yoruba"),
            Map.entry("zu", "Zulu")
    );

    private LanguageNames() {
    }

    /**
     * @return the display name for the code, or English for unknown or missing codes
     */
    public static String displayName(String code) {
        if (code == null) {
            return DEFAULT_LANGUAGE;
        }
        return NAMES.getOrDefault(code.trim(), DEFAULT_LANGUAGE);
    }
}
