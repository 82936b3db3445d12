package com.vidnyan.codesense.adapter.out.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds the synthetic training corpus: fixed clean and defective exemplars, then
 * {@code samplesPerClass} template-generated pairs (one clean, one defective).
 * The output depends only on the seed.
 */
public class SyntheticCorpusGenerator {

    static final List<String> CLEAN_EXEMPLARS = List.of(
            """
            def calculate_sum(numbers: List[int]) -> int:
                '''Calculate the sum of numbers.'''
                if not numbers:
                    return 0
                return sum(numbers)""",
            """
            async def fetch_data(url: str) -> dict:
                '''Fetch data from URL with proper error handling.'''
                try:
                    response = await client.get(url)
                    response.raise_for_status()
                    return response.json()
                except HTTPError as e:
                    logger.error(f"HTTP error: {e}")
                    raise""",
            """
            class UserService:
                '''Service for user operations.'''

                def __init__(self, repository: UserRepository):
                    self._repository = repository

                def get_user(self, user_id: int) -> Optional[User]:
                    '''Get user by ID.'''
                    return self._repository.find_by_id(user_id)""");

    static final List<String> DEFECTIVE_EXEMPLARS = List.of(
            """
            def process(x):
                try:
                    result = eval(x)
                    exec(x)
                except:
                    pass
                return result""",
            """
            def login(user, pwd):
                password = "admin123"
                if pwd == password:
                    global logged_in
                    logged_in = True
                print("Login: " + pwd)""",
            """
            def fetch(url):
                import os
                os.system("curl " + url)
                data = None
                if data == None:
                    pass""",
            """
            var x = 1;
            eval(userInput);
            document.innerHTML = data;
            console.log(x);""");

    private static final List<String> CLEAN_TEMPLATES = List.of(
            "def {name}({params}) -> {ret}:\n    '''{doc}'''\n    return {value}",
            "class {name}:\n    '''{doc}'''\n    def __init__(self):\n        pass",
            "async def {name}():\n    '''{doc}'''\n    result = await operation()\n    return result");

    private static final List<String> CLEAN_NAMES = List.of("process", "calculate", "fetch", "handle", "validate");
    private static final List<String> CLEAN_PARAMS = List.of("data: dict", "items: list", "value: int", "name: str");
    private static final List<String> CLEAN_DOCS = List.of("Process the data.", "Calculate result.", "Handle operation.");

    private static final List<String> DEFECTIVE_TEMPLATES = List.of(
            "def {name}():\n    try:\n        eval(input())\n    except:\n        pass",
            "var {name};\nconsole.log({name});\neval(data);",
            "def {name}(x):\n    global state\n    exec(x)\n    password = 'secret123'",
            "function {name}() {\n    document.innerHTML = data;\n    eval(code);\n}");

    private static final List<String> DEFECTIVE_NAMES = List.of("process", "handle", "execute", "run");

    private final int samplesPerClass;

    public SyntheticCorpusGenerator(int samplesPerClass) {
        if (samplesPerClass < 0) {
            throw new IllegalArgumentException("samplesPerClass must not be negative");
        }
        this.samplesPerClass = samplesPerClass;
    }

    public List<TrainingSample> generate(long seed) {
        Random random = new Random(seed);
        List<TrainingSample> samples = new ArrayList<>();
        CLEAN_EXEMPLARS.forEach(code -> samples.add(new TrainingSample(code, TrainingSample.CLEAN)));
        DEFECTIVE_EXEMPLARS.forEach(code -> samples.add(new TrainingSample(code, TrainingSample.DEFECTIVE)));
        for (int i = 0; i < samplesPerClass; i++) {
            samples.add(new TrainingSample(cleanSample(random), TrainingSample.CLEAN));
            samples.add(new TrainingSample(defectiveSample(random), TrainingSample.DEFECTIVE));
        }
        return samples;
    }

    private static String cleanSample(Random random) {
        return pick(CLEAN_TEMPLATES, random)
                .replace("{name}", pick(CLEAN_NAMES, random))
                .replace("{params}", pick(CLEAN_PARAMS, random))
                .replace("{ret}", "dict")
                .replace("{doc}", pick(CLEAN_DOCS, random))
                .replace("{value}", "result");
    }

    private static String defectiveSample(Random random) {
        return pick(DEFECTIVE_TEMPLATES, random).replace("{name}", pick(DEFECTIVE_NAMES, random));
    }

    private static String pick(List<String> options, Random random) {
        return options.get(random.nextInt(options.size()));
    }
}
