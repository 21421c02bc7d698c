package com.bookreader.nlp.text;

import com.bookreader.nlp.core.DescriptionType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Literary gazetteer for Russian fiction.
 *
 * <p>Word lists are declared as dictionary forms and stemmed through the shared
 * {@link RussianTextAnalyzer} at construction, so lookups compare Snowball stems and
 * match inflected forms in the text.</p>
 */
@ApplicationScoped
public class RussianLexicon {

    private static final Logger LOG = LoggerFactory.getLogger(RussianLexicon.class);

    static final List<String> LOCATION_WORDS = List.of(
        "замок", "холм", "город", "деревня", "село", "поселок", "столица", "лес", "роща", "поле",
        "луг", "река", "озеро", "море", "океан", "берег", "гора", "долина", "равнина", "степь",
        "болото", "пустыня", "остров", "пещера", "дом", "дворец", "башня", "крепость", "храм",
        "церковь", "собор", "монастырь", "комната", "зал", "кабинет", "библиотека", "подвал",
        "чердак", "коридор", "лестница", "улица", "площадь", "переулок", "сад", "парк", "мост",
        "дорога", "тропа", "двор", "хижина", "изба", "таверна", "трактир", "усадьба", "особняк",
        "королевство", "ворота", "стена", "руины"
    );

    static final List<String> CHARACTER_WORDS = List.of(
        "человек", "мужчина", "женщина", "старик", "старуха", "девушка", "юноша", "мальчик",
        "девочка", "ребенок", "маг", "волшебник", "колдун", "ведьма", "король", "королева",
        "принц", "принцесса", "рыцарь", "воин", "солдат", "князь", "княгиня", "граф", "барон",
        "купец", "крестьянин", "монах", "священник", "стражник", "незнакомец", "путник",
        "эльф", "гном", "лицо", "глаза", "волосы", "борода", "плечи", "взгляд", "улыбка"
    );

    static final List<String> ATMOSPHERE_WORDS = List.of(
        "туман", "тишина", "мрак", "тьма", "сумрак", "полумрак", "мгла", "свет", "тень",
        "воздух", "ветер", "дождь", "снег", "гроза", "буря", "холод", "тепло", "запах", "аромат",
        "звук", "шум", "шорох", "эхо", "атмосфера", "настроение", "рассвет", "закат", "сумерки",
        "ночь", "утро", "вечер", "солнце", "луна", "звезды", "небо", "облака", "сияние",
        "тоска", "печаль", "покой", "ужас", "страх"
    );

    static final List<String> OBJECT_WORDS = List.of(
        "меч", "щит", "книга", "кольцо", "посох", "плащ", "шляпа", "корона", "трон", "стол",
        "стул", "кресло", "камин", "свеча", "лампа", "фонарь", "окно", "дверь", "зеркало",
        "сундук", "ключ", "карта", "письмо", "кубок", "чаша", "картина", "ковер", "кровать",
        "часы", "шкатулка", "амулет", "кинжал", "доспехи", "платье", "сапоги"
    );

    static final List<String> ACTION_WORDS = List.of(
        "пошел", "пошла", "побежал", "побежала", "сказал", "сказала", "подумал", "подумала",
        "решил", "решила", "сделал", "сделала", "вошел", "вошла", "вышел", "вышла", "ударил",
        "схватил", "бросил", "крикнул", "прыгнул", "открыл", "закрыл", "повернулся", "поднял",
        "взял", "посмотрел", "ответил", "спросил", "встал", "уселся", "ушел", "пришел", "бежал",
        "шагнул", "рванулся", "атаковал", "толкнул", "выхватил", "бросился"
    );

    static final List<String> DESCRIPTIVE_ADJECTIVES = List.of(
        "высокий", "низкий", "темный", "светлый", "старый", "древний", "огромный", "маленький",
        "большой", "мрачный", "величественный", "красивый", "прекрасный", "густой", "холодный",
        "теплый", "яркий", "тусклый", "серый", "черный", "белый", "красный", "зеленый", "синий",
        "золотой", "серебряный", "каменный", "деревянный", "узкий", "широкий", "длинный",
        "тихий", "громкий", "пустой", "заброшенный", "таинственный", "зловещий", "уютный",
        "ветхий", "седой", "морщинистый", "бледный", "стройный", "туманный", "сырой",
        "влажный", "мягкий", "тяжелый", "могучий", "роскошный", "пыльный"
    );

    static final List<String> SENSORY_WORDS = List.of(
        "свет", "тень", "запах", "аромат", "звук", "шорох", "сияние", "блеск", "цвет",
        "тишина", "мрак", "туман", "холод", "тепло", "эхо", "мгла"
    );

    static final List<String> STATE_VERBS = List.of(
        "возвышался", "возвышалась", "виднелся", "виднелась", "простирался", "простиралась",
        "раскинулся", "раскинулась", "казался", "казалась", "выглядел", "выглядела", "темнел",
        "белел", "сиял", "сияла", "блестел", "блестела", "стоял", "стояла", "тянулся", "тянулась"
    );

    static final Set<String> PREPOSITIONS = Set.of(
        "в", "во", "на", "под", "над", "за", "перед", "у", "возле", "около", "среди", "из",
        "с", "со", "к", "по", "от", "до", "через", "между", "вдоль", "при", "сквозь"
    );

    static final Set<String> PRONOMINAL_ADJECTIVES = Set.of(
        "мой", "твой", "свой", "наш", "ваш", "какой", "такой", "который", "этот", "тот",
        "весь", "сам", "самый", "никакой", "другой", "каждый", "любой", "иной", "чей", "кой",
        "моей", "твоей", "своей", "нашей", "вашей", "какой-то", "такая", "такое", "какая",
        "которая", "которое", "которые", "другие", "другая", "другое", "каждая", "самая"
    );

    static final Set<String> FIRST_NAMES = Set.of(
        "иван", "петр", "александр", "алексей", "сергей", "николай", "дмитрий", "михаил",
        "андрей", "владимир", "павел", "федор", "василий", "григорий", "борис", "лев",
        "анна", "мария", "елена", "ольга", "татьяна", "наталья", "екатерина", "софья",
        "наташа", "маша", "катя", "таня", "петя", "ваня", "саша", "аня", "лиза", "соня"
    );

    static final List<String> TOPONYM_CUES = List.of(
        "город", "село", "деревня", "поселок", "река", "гора", "озеро", "море", "остров",
        "улица", "площадь", "королевство", "царство", "страна", "край", "земля", "замок", "лес"
    );

    private static final Pattern ADJECTIVE_ENDING = Pattern.compile(
        ".{2,}(ый|ий|ой|ая|яя|ое|ее|ые|ие|ого|его|ому|ему|ым|им|ую|юю|ых|их|ыми|ими)$");

    private final Map<String, DescriptionType> typeStems;
    private final Set<String> adjectiveStems;
    private final Set<String> descriptiveStems;
    private final Set<String> actionStems;
    private final Set<String> toponymCueStems;

    @Inject
    public RussianLexicon(RussianTextAnalyzer analyzer) {
        Map<DescriptionType, List<String>> byType = new EnumMap<>(DescriptionType.class);
        byType.put(DescriptionType.LOCATION, LOCATION_WORDS);
        byType.put(DescriptionType.CHARACTER, CHARACTER_WORDS);
        byType.put(DescriptionType.ATMOSPHERE, ATMOSPHERE_WORDS);
        byType.put(DescriptionType.OBJECT, OBJECT_WORDS);
        byType.put(DescriptionType.ACTION, ACTION_WORDS);

        Map<String, DescriptionType> stems = new HashMap<>();
        byType.forEach((type, words) -> words.forEach(word -> stems.putIfAbsent(analyzer.stem(word), type)));
        this.typeStems = Map.copyOf(stems);

        this.adjectiveStems = stemAll(analyzer, DESCRIPTIVE_ADJECTIVES);
        Set<String> descriptive = new HashSet<>(adjectiveStems);
        descriptive.addAll(stemAll(analyzer, SENSORY_WORDS));
        descriptive.addAll(stemAll(analyzer, STATE_VERBS));
        this.descriptiveStems = Set.copyOf(descriptive);
        this.actionStems = stemAll(analyzer, ACTION_WORDS);
        this.toponymCueStems = stemAll(analyzer, TOPONYM_CUES);

        LOG.debug("Lexicon loaded: {} typed stems, {} descriptive stems, {} action stems",
            typeStems.size(), descriptiveStems.size(), actionStems.size());
    }

    private static Set<String> stemAll(RussianTextAnalyzer analyzer, Collection<String> words) {
        Set<String> stems = new HashSet<>();
        for (String word : words) {
            stems.add(analyzer.stem(word));
        }
        return Set.copyOf(stems);
    }

    /**
     * Description type hinted by the token, if it is a gazetteer word.
     */
    @NotNull
    public Optional<DescriptionType> typeOf(@NotNull Token token) {
        return Optional.ofNullable(typeStems.get(token.stem()));
    }

    /**
     * Descriptive adjectives, sensory nouns and verbs of state.
     */
    public boolean isDescriptive(@NotNull Token token) {
        return descriptiveStems.contains(token.stem());
    }

    public boolean isAction(@NotNull Token token) {
        return actionStems.contains(token.stem());
    }

    /**
     * Known descriptive adjective, or a word with an adjectival ending.
     */
    public boolean isAdjective(@NotNull Token token) {
        if (adjectiveStems.contains(token.stem())) {
            return true;
        }
        String lower = token.lower();
        return !PRONOMINAL_ADJECTIVES.contains(lower) && ADJECTIVE_ENDING.matcher(lower).matches();
    }

    public boolean isPreposition(@NotNull Token token) {
        return PREPOSITIONS.contains(token.lower());
    }

    /**
     * Content noun heuristic: a gazetteer word, or a word that is neither adjective,
     * preposition nor a short function word.
     */
    public boolean isNoun(@NotNull Token token) {
        if (typeStems.containsKey(token.stem())) {
            return true;
        }
        return token.length() > 2
            && !isAdjective(token)
            && !isPreposition(token)
            && !actionStems.contains(token.stem())
            && token.lower().chars().allMatch(Character::isLetter);
    }

    public boolean isFirstName(@NotNull String word) {
        return FIRST_NAMES.contains(RussianTextAnalyzer.fold(word).toLowerCase(Locale.ROOT));
    }

    public boolean isToponymCue(@NotNull Token token) {
        return toponymCueStems.contains(token.stem());
    }
}
