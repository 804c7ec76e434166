import static contracts.Contracts.*;

public class Factorial {

    /**
     * Calculates the factorial of a number.
     */
    public static int factorial(int n) {
        pre("n >= 0");
        post("result >= 1");

        int result = 1;
        int counter = 1;

        invariant("result == factorial(counter - 1) && counter <= n + 1");
        while (counter <= n) {
            result *= counter;
            counter += 1;
        }

        if (n == 0) {
            result = 1; // Special case for 0! which is 1.
        } else if (n < 0) {
            result = 0; // Handling negative inputs.
        }

        return result;
    }

    public static void main(String[] args) {
        int num = 5;
        System.out.println("Factorial of " + num + " is " + factorial(num));
    }
}
